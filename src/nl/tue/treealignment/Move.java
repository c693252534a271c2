package nl.tue.treealignment;

/**
 * A single step of an alignment: a pair of a log symbol and a model symbol,
 * either of which may be the skip symbol {@link #SKIP}.
 */
public class Move {

	public static final String SKIP = ">>";

	public static enum Type {
		SYNC, LOG, MODEL
	}

	private final String log;
	private final String model;

	private Move(String log, String model) {
		this.log = log;
		this.model = model;
	}

	public static Move synchronous(String activity) {
		return new Move(activity, activity);
	}

	public static Move onLog(String activity) {
		return new Move(activity, SKIP);
	}

	public static Move onModel(String activity) {
		return new Move(SKIP, activity);
	}

	public String getLogSymbol() {
		return log;
	}

	public String getModelSymbol() {
		return model;
	}

	public Type getType() {
		if (SKIP.equals(model)) {
			return Type.LOG;
		} else if (SKIP.equals(log)) {
			return Type.MODEL;
		}
		return Type.SYNC;
	}

	public int hashCode() {
		return 31 * log.hashCode() + model.hashCode();
	}

	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Move)) {
			return false;
		}
		Move other = (Move) o;
		return log.equals(other.log) && model.equals(other.model);
	}

	public String toString() {
		return "(" + log + "," + model + ")";
	}
}
