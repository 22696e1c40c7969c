package cl.uchile.dcc.unionfind;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;

import com.google.common.primitives.Ints;

import cl.uchile.dcc.unionfind.util.Components;

/**
 * A disjoint-set (union-find) forest over the dense universe of
 * elements <code>0 .. count()-1</code>.
 *
 * Each element is an index into a set of flat arrays: its parent
 * ("leader"), a rank bounding the height of its subtree, the size of
 * its set (kept at roots only) and an intrusive doubly-linked list of
 * its children. The child lists allow a single element to be moved
 * to another set in time proportional to its number of children,
 * without leaving the elements that pointed through it mis-rooted.
 *
 * The structure is not thread-safe: every call, including
 * {@link #connected(int, int)}, may compress paths and so modify
 * state. See {@link SharedDisjointSet} for a locked wrapper.
 */
public class DisjointSet {
	static final int NONE = -1;

	// leave room for array headers
	public static final int MAX_ELEMENTS = Integer.MAX_VALUE - 8;

	private static final int MIN_CAPACITY = 16;

	private final MergePolicy merge;
	private final PathCompression compression;

	// number of live elements and number of roots
	private int count;
	private int sets;

	// parent links; roots link to themselves
	private int[] leader;

	// one more than the highest child rank; the exact subtree height
	// until path compression removes children
	private int[] rank;

	// elements in the set, valid at roots only
	private int[] size;

	// child lists
	private int[] firstChild;
	private int[] nextSibling;
	private int[] prevSibling;

	/**
	 * Create an empty universe with default arguments.
	 */
	public DisjointSet(){
		this(0);
	}

	/**
	 * Create a universe of n singleton sets with default arguments.
	 * @param n
	 */
	public DisjointSet(int n){
		this(n, new DisjointSetArgs());
	}

	/**
	 * Create a universe of n singleton sets with custom arguments
	 * (e.g., naive merging or no path compression).
	 * @param n
	 * @param args
	 */
	public DisjointSet(int n, DisjointSetArgs args){
		checkArgument(n >= 0, "Negative universe size: %s", n);
		this.merge = args.getMergePolicy();
		this.compression = args.getPathCompression();
		clear();
		extend(n);
	}

	/**
	 * Appends n new singleton elements with indexes
	 * <code>[count(), count()+n)</code>. Existing elements
	 * keep their index and their set.
	 * @param n
	 */
	public void extend(int n){
		checkArgument(n >= 0, "Cannot extend by a negative number of elements: %s", n);
		checkArgument(n <= MAX_ELEMENTS - count, "Universe of %s elements cannot grow by %s", count, n);
		if(n == 0){
			return;
		}

		int newCount = count + n;
		ensureCapacity(newCount);
		for(int i = count; i < newCount; i++){
			leader[i] = i;
			rank[i] = 0;
			size[i] = 1;
			firstChild[i] = NONE;
			nextSibling[i] = NONE;
			prevSibling[i] = NONE;
		}
		count = newCount;
		sets += n;
	}

	/**
	 * Resets to the empty universe.
	 */
	public void clear(){
		count = 0;
		sets = 0;
		leader = new int[0];
		rank = new int[0];
		size = new int[0];
		firstChild = new int[0];
		nextSibling = new int[0];
		prevSibling = new int[0];
	}

	public int count(){
		return count;
	}

	/**
	 * @return the number of disjoint sets
	 */
	public int setCount(){
		return sets;
	}

	/**
	 * Finds the root of p's set, compressing the path walked
	 * according to the configured {@link PathCompression}.
	 *
	 * @param p
	 * @return the representative of p's set
	 * @throws IndexOutOfBoundsException if p is not an element
	 */
	public int findLeader(int p){
		checkElementIndex(p, count, "element");
		switch(compression){
		case FULL: return findAndCompress(p);
		case HALVING: return findAndHalve(p);
		default: return findRoot(p);
		}
	}

	public boolean connected(int p, int q){
		checkElementIndex(q, count, "element");
		return findLeader(p) == findLeader(q);
	}

	/**
	 * Merges the sets of p and q.
	 *
	 * @param p
	 * @param q
	 * @return false if p and q were already connected, true otherwise
	 */
	public boolean union(int p, int q){
		checkElementIndex(q, count, "element");
		int rp = findLeader(p);
		int rq = findLeader(q);
		if(rp == rq){
			return false;
		}
		mergeRoots(rp, rq);
		return true;
	}

	/**
	 * Moves p out of its set and into q's set. The elements
	 * left behind stay connected to each other: any children
	 * of p are handed to p's parent or, if p was the root, to
	 * one of its children which becomes the new root.
	 *
	 * @param p
	 * @param q
	 * @return false if p and q were already connected, true otherwise
	 */
	public boolean move(int p, int q){
		checkElementIndex(q, count, "element");
		int rp = findLeader(p);
		int rq = findLeader(q);
		if(rp == rq){
			return false;
		}
		detach(p, rp);
		mergeRoots(p, rq);
		return true;
	}

	/**
	 * @param p
	 * @return the number of elements in p's set
	 */
	public int size(int p){
		return size[findLeader(p)];
	}

	/**
	 * The number of links between p and its root. Does not
	 * compress the path.
	 *
	 * @param p
	 * @return 0 for a root
	 */
	public int depth(int p){
		checkElementIndex(p, count, "element");
		int d = 0;
		while(leader[p] != p){
			p = leader[p];
			d++;
		}
		return d;
	}

	/**
	 * @return all sets keyed by their root
	 */
	public Components components(){
		Components comps = new Components();
		for(int i = 0; i < count; i++){
			comps.add(findLeader(i), i);
		}
		return comps;
	}

	int parentOf(int p){
		checkElementIndex(p, count, "element");
		return leader[p];
	}

	int rankOf(int p){
		checkElementIndex(p, count, "element");
		return rank[p];
	}

	int[] childrenOf(int p){
		checkElementIndex(p, count, "element");
		int n = 0;
		for(int c = firstChild[p]; c != NONE; c = nextSibling[c]){
			n++;
		}
		int[] children = new int[n];
		int i = 0;
		for(int c = firstChild[p]; c != NONE; c = nextSibling[c]){
			children[i++] = c;
		}
		return children;
	}

	private int findRoot(int p){
		while(leader[p] != p){
			p = leader[p];
		}
		return p;
	}

	private int findAndCompress(int p){
		int root = findRoot(p);
		while(leader[p] != root){
			int next = leader[p];
			relink(p, root);
			p = next;
		}
		return root;
	}

	private int findAndHalve(int p){
		while(leader[p] != p){
			int parent = leader[p];
			int grandparent = leader[parent];
			if(grandparent != parent){
				relink(p, grandparent);
			}
			p = grandparent;
		}
		return p;
	}

	/**
	 * Attaches one root below the other.
	 * @return the surviving root
	 */
	private int mergeRoots(int rp, int rq){
		int child, root;
		if(merge == MergePolicy.NAIVE){
			child = rp;
			root = rq;
			rank[root] = Math.max(rank[root], rank[child] + 1);
		} else if(rank[rp] < rank[rq]){
			child = rp;
			root = rq;
		} else if(rank[rp] > rank[rq]){
			child = rq;
			root = rp;
		} else{
			child = rq;
			root = rp;
			rank[root]++;
		}

		link(child, root);
		size[root] += size[child];
		sets--;
		return root;
	}

	/**
	 * Turns p into a singleton, keeping the rest of its
	 * old set (with root rp) in one tree.
	 */
	private void detach(int p, int rp){
		if(size[rp] == 1){
			return;
		}

		if(p != rp){
			int parent = leader[p];
			unlink(p);
			adoptChildren(p, parent);
			lowerRanks(parent);
			size[rp]--;
		} else{
			// promote the highest ranked child; if another child
			// has the same rank the heir must grow to stay above it
			int heir = NONE;
			for(int c = firstChild[p]; c != NONE; c = nextSibling[c]){
				if(heir == NONE || rank[c] > rank[heir]){
					heir = c;
				}
			}
			int heirRank = rank[heir];
			for(int c = firstChild[p]; c != NONE; c = nextSibling[c]){
				if(c != heir && rank[c] == rank[heir]){
					heirRank++;
					break;
				}
			}

			unlink(heir);
			adoptChildren(p, heir);
			leader[heir] = heir;
			rank[heir] = heirRank;
			size[heir] = size[p] - 1;
		}

		leader[p] = p;
		rank[p] = 0;
		size[p] = 1;
		sets++;
	}

	/**
	 * Re-parents all children of from under to, splicing the
	 * child list of from onto the front of the child list of to.
	 */
	private void adoptChildren(int from, int to){
		int head = firstChild[from];
		if(head == NONE){
			return;
		}
		int tail = head;
		leader[head] = to;
		while(nextSibling[tail] != NONE){
			tail = nextSibling[tail];
			leader[tail] = to;
		}

		int old = firstChild[to];
		nextSibling[tail] = old;
		if(old != NONE){
			prevSibling[old] = tail;
		}
		firstChild[to] = head;
		firstChild[from] = NONE;
	}

	/**
	 * Recomputes the rank of x, and of its ancestors while they change,
	 * as one more than the highest rank among its children (0 for a leaf).
	 * Called after a child of x was replaced by that child's own
	 * children, so no rank can grow.
	 */
	private void lowerRanks(int x){
		while(true){
			int r = 0;
			for(int c = firstChild[x]; c != NONE; c = nextSibling[c]){
				r = Math.max(r, rank[c] + 1);
			}
			if(r == rank[x]){
				return;
			}
			rank[x] = r;
			if(leader[x] == x){
				return;
			}
			x = leader[x];
		}
	}

	private void relink(int x, int parent){
		unlink(x);
		link(x, parent);
	}

	private void link(int x, int parent){
		int head = firstChild[parent];
		nextSibling[x] = head;
		prevSibling[x] = NONE;
		if(head != NONE){
			prevSibling[head] = x;
		}
		firstChild[parent] = x;
		leader[x] = parent;
	}

	// x must not be a root
	private void unlink(int x){
		int prev = prevSibling[x];
		int next = nextSibling[x];
		if(prev == NONE){
			firstChild[leader[x]] = next;
		} else{
			nextSibling[prev] = next;
		}
		if(next != NONE){
			prevSibling[next] = prev;
		}
		prevSibling[x] = NONE;
		nextSibling[x] = NONE;
	}

	private void ensureCapacity(int minLength){
		if(leader.length >= minLength){
			return;
		}
		int padding = (int) Math.min(Math.max(minLength / 2L, MIN_CAPACITY), (long) MAX_ELEMENTS - minLength);
		leader = Ints.ensureCapacity(leader, minLength, padding);
		rank = Ints.ensureCapacity(rank, minLength, padding);
		size = Ints.ensureCapacity(size, minLength, padding);
		firstChild = Ints.ensureCapacity(firstChild, minLength, padding);
		nextSibling = Ints.ensureCapacity(nextSibling, minLength, padding);
		prevSibling = Ints.ensureCapacity(prevSibling, minLength, padding);
	}

	@Override
	public String toString(){
		return "DisjointSet[count="+count+", sets="+sets+", merge="+merge+", compression="+compression+", leaders="+Arrays.toString(Arrays.copyOf(leader, Math.min(count, 32)))+"]";
	}

	/**
	 * How two roots are joined.
	 */
	public enum MergePolicy {
		/** attach the lower ranked root below the higher ranked one */
		BY_RANK,
		/** always attach the first root below the second (quick-union) */
		NAIVE
	}

	/**
	 * What {@link DisjointSet#findLeader(int)} does to the path it walks.
	 */
	public enum PathCompression {
		/** point every node on the path at the root */
		FULL,
		/** point every other node on the path at its grandparent */
		HALVING,
		NONE
	}

	public static class DisjointSetArgs{
		public static MergePolicy DEFAULT_MERGE = MergePolicy.BY_RANK;
		public static PathCompression DEFAULT_COMPRESSION = PathCompression.FULL;

		private MergePolicy merge = DEFAULT_MERGE;

		private PathCompression compression = DEFAULT_COMPRESSION;

		public DisjointSetArgs(){

		}

		/**
		 * Set how roots are joined by union and move.
		 * NAIVE gives no depth guarantee: use for comparison only.
		 * @param merge
		 */
		public void setMergePolicy(MergePolicy merge){
			this.merge = merge;
		}

		public MergePolicy getMergePolicy(){
			return merge;
		}

		public void setPathCompression(PathCompression compression){
			this.compression = compression;
		}

		public PathCompression getPathCompression(){
			return compression;
		}
	}
}
