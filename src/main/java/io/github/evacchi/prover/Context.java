package io.github.evacchi.prover;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

import io.github.evacchi.prover.syntax.Printer;

/**
 * An immutable typing context: a list of hypotheses, most recent first.
 * <p>
 * The same name may be bound more than once; {@link #lookup(String)} sees the
 * most recent binding only. {@link #extend(String, Type)} never touches the
 * receiver, so a context can be handed to several subgoals at once.
 */
public final class Context implements Iterable<Context.Binding> {

    public record Binding(String name, Type type) {}

    public static final Context EMPTY = new Context(null, null);

    private final Binding head;
    private final Context tail;

    private Context(Binding head, Context tail) {
        this.head = head; this.tail = tail;
    }

    public Context extend(String name, Type type) {
        return new Context(new Binding(Objects.requireNonNull(name), Objects.requireNonNull(type)), this);
    }

    public Optional<Type> lookup(String name) {
        for (Binding b : this) {
            if (b.name().equals(name)) return Optional.of(b.type());
        }
        return Optional.empty();
    }

    public boolean isEmpty() { return head == null; }

    @Override
    public Iterator<Binding> iterator() {
        return new Iterator<>() {
            Context current = Context.this;
            public boolean hasNext() { return !current.isEmpty(); }
            public Binding next() {
                if (current.isEmpty()) throw new NoSuchElementException();
                var b = current.head;
                current = current.tail;
                return b;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Context that)) return false;
        return Objects.equals(head, that.head) && Objects.equals(tail, that.tail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(head, tail);
    }

    @Override
    public String toString() { return Printer.print(this); }
}
