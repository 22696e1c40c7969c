package cl.uchile.dcc.unionfind.util;

import java.util.Comparator;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The sets of a partition, each keyed by its representative
 * and holding its members in ascending order.
 *
 */
public class Components extends TreeMap<Integer,TreeSet<Integer>> {
	/**
	 *
	 */
	private static final long serialVersionUID = 1L;

	// larger sets first, ties by lowest member
	public static final Comparator<TreeSet<Integer>> SIZE_DESC = new Comparator<TreeSet<Integer>>(){
		@Override
		public int compare(TreeSet<Integer> a, TreeSet<Integer> b) {
			int d = b.size() - a.size();
			if(d == 0){
				d = a.first().compareTo(b.first());
			}
			return d;
		}
	};

	private int elements = 0;

	public Components(){
		super();
	}

	public boolean add(int root, int element){
		TreeSet<Integer> set = get(root);
		if(set == null){
			set = new TreeSet<Integer>();
			put(root, set);
		}
		boolean added = set.add(element);
		if(added){
			elements++;
		}
		return added;
	}

	public int countComponents(){
		return size();
	}

	public int countElements(){
		return elements;
	}

	/**
	 * @return the members of the component holding the most
	 * elements, or null if empty
	 */
	public TreeSet<Integer> largest(){
		TreeSet<Integer> max = null;
		for(TreeSet<Integer> set : values()){
			if(max == null || SIZE_DESC.compare(set, max) < 0){
				max = set;
			}
		}
		return max;
	}
}
