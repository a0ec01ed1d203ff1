package freec.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Position of a subterm: the 1-based indices of the children on the path from the root.
 *
 * @see Subterm#children(freec.ast.ir.IrExpr)
 */
public record Pos(List<Integer> path) {
	public static final Pos ROOT = new Pos(List.of());

	public Pos {
		path = List.copyOf(path);
	}

	public static Pos of(Integer... indices) {
		return new Pos(List.of(indices));
	}

	public Pos child(int index) {
		List<Integer> childPath = new ArrayList<>(path);
		childPath.add(index);
		return new Pos(childPath);
	}

	/**
	 * Whether this position is strictly below the other, i.e. the other position is a proper prefix of this one.
	 */
	public boolean below(Pos other) {
		return other.path.size() < path.size() && path.subList(0, other.path.size()).equals(other.path);
	}

	@Override
	public String toString() {
		return path.toString();
	}
}
