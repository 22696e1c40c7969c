package cl.uchile.dcc.unionfind;

import java.util.concurrent.locks.ReentrantLock;

import cl.uchile.dcc.unionfind.DisjointSet.DisjointSetArgs;

/**
 * Owns a single {@link DisjointSet} and serialises every access to it
 * through one lock. Lookups take the lock too, since finding a leader
 * compresses paths.
 *
 * Callers that want to run several operations without interleaving
 * from other threads should pass them as a {@link Batch}.
 */
public class SharedDisjointSet {
	private final DisjointSet set;
	private final ReentrantLock lock = new ReentrantLock();

	public SharedDisjointSet(int n){
		this(n, new DisjointSetArgs());
	}

	public SharedDisjointSet(int n, DisjointSetArgs args){
		this.set = new DisjointSet(n, args);
	}

	/**
	 * Runs the batch while holding the lock.
	 * @param batch
	 * @return whatever the batch returns
	 */
	public <T> T apply(Batch<T> batch){
		lock.lock();
		try{
			return batch.run(set);
		} finally{
			lock.unlock();
		}
	}

	public void extend(int n){
		lock.lock();
		try{
			set.extend(n);
		} finally{
			lock.unlock();
		}
	}

	public void clear(){
		lock.lock();
		try{
			set.clear();
		} finally{
			lock.unlock();
		}
	}

	public int findLeader(int p){
		lock.lock();
		try{
			return set.findLeader(p);
		} finally{
			lock.unlock();
		}
	}

	public boolean connected(int p, int q){
		lock.lock();
		try{
			return set.connected(p, q);
		} finally{
			lock.unlock();
		}
	}

	public boolean union(int p, int q){
		lock.lock();
		try{
			return set.union(p, q);
		} finally{
			lock.unlock();
		}
	}

	public boolean move(int p, int q){
		lock.lock();
		try{
			return set.move(p, q);
		} finally{
			lock.unlock();
		}
	}

	public int count(){
		lock.lock();
		try{
			return set.count();
		} finally{
			lock.unlock();
		}
	}

	public int setCount(){
		lock.lock();
		try{
			return set.setCount();
		} finally{
			lock.unlock();
		}
	}

	/**
	 * A group of operations run against the set under one
	 * hold of the lock. Must not hand the set to other threads.
	 *
	 * @param <T> the result type
	 */
	public interface Batch<T> {
		T run(DisjointSet set);
	}
}
