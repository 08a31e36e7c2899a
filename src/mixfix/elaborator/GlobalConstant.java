package mixfix.elaborator;

import mixfix.model.term.QualifiedName;

import java.util.Objects;

public class GlobalConstant {
	private final QualifiedName name;
	private final int implicitArguments;

	public GlobalConstant(QualifiedName name, int implicitArguments) {
		this.name = name;
		this.implicitArguments = implicitArguments;
	}

	public QualifiedName getName() {
		return name;
	}

	/**
	 * @return how many leading arguments are inserted as {@code _} rather than written
	 */
	public int getImplicitArguments() {
		return implicitArguments;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, implicitArguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		GlobalConstant other = (GlobalConstant) obj;
		return implicitArguments == other.implicitArguments && name.equals(other.name);
	}

	@Override
	public String toString() {
		return name + (implicitArguments > 0 ? " {" + implicitArguments + " implicit}" : "");
	}
}
