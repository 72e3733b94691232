package org.boc.helper;

/**
 * An immutable pair.
 */
public class Tuple<A,B> {

    private final A a;
    private final B b;

    public Tuple(A a, B b)
    {
        this.a = a;
        this.b = b;
    }

    public A getA() {
        return a;
    }

    public B getB() {
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tuple)) {
            return false;
        }
        Tuple<?, ?> other = (Tuple<?, ?>) o;
        return (a == null ? other.a == null : a.equals(other.a))
                && (b == null ? other.b == null : b.equals(other.b));
    }

    @Override
    public int hashCode() {
        return 31 * (a == null ? 0 : a.hashCode()) + (b == null ? 0 : b.hashCode());
    }

    @Override
    public String toString() {
        return "(" + a + ", " + b + ")";
    }
}
