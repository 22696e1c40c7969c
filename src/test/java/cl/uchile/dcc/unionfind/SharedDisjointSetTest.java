package cl.uchile.dcc.unionfind;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import cl.uchile.dcc.unionfind.SharedDisjointSet.Batch;

public class SharedDisjointSetTest {

	@Test
	public void testConcurrentUnions() throws Exception {
		final int n = 4000;
		final int threads = 4;
		final SharedDisjointSet shared = new SharedDisjointSet(n);

		ExecutorService executor = Executors.newFixedThreadPool(threads);
		List<Future<Integer>> futures = new ArrayList<Future<Integer>>();
		for(int t = 0; t < threads; t++){
			final int offset = t;
			futures.add(executor.submit(new Callable<Integer>(){
				@Override
				public Integer call() {
					int merges = 0;
					// every worker queries too, which compresses paths
					for(int i = offset; i < n - 1; i += threads){
						if(shared.union(i, i + 1)){
							merges++;
						}
						shared.connected(0, i);
					}
					return merges;
				}
			}));
		}

		int merges = 0;
		for(Future<Integer> f : futures){
			merges += f.get();
		}
		executor.shutdownNow();
		executor.awaitTermination(1, TimeUnit.MINUTES);

		// the edges form a path, so each one merges exactly once
		assertEquals(n - 1, merges);
		assertEquals(1, shared.setCount());
		assertEquals(n, shared.count());
		assertTrue(shared.connected(0, n - 1));
	}

	@Test
	public void testBatchRunsUnderOneLock() {
		SharedDisjointSet shared = new SharedDisjointSet(3);
		Boolean connected = shared.apply(new Batch<Boolean>(){
			@Override
			public Boolean run(DisjointSet set) {
				set.union(0, 1);
				set.move(1, 2);
				return set.connected(0, 1);
			}
		});
		assertFalse(connected);
		assertTrue(shared.connected(1, 2));
		assertEquals(2, shared.setCount());
	}

	@Test
	public void testSingleOperations() {
		SharedDisjointSet shared = new SharedDisjointSet(2);
		shared.extend(2);
		assertEquals(4, shared.count());
		assertTrue(shared.union(0, 3));
		assertEquals(shared.findLeader(0), shared.findLeader(3));
		assertTrue(shared.move(3, 1));
		assertFalse(shared.connected(0, 3));
		shared.clear();
		assertEquals(0, shared.count());
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testOutOfRange() {
		new SharedDisjointSet(2).union(0, 2);
	}
}
