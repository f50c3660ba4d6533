package de.burger.typehook.scope;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Stack of the class and function scopes enclosing the node currently being rewritten.
 * The stack is empty at module level; its depth always equals the nesting depth of the
 * traversal. One tracker belongs to exactly one traversal and is not thread-safe.
 *
 * <p>Prefer {@link #enter} with try-with-resources so the frame is popped on every exit path:
 * <pre>{@code
 * try (ScopeTracker.Entered ignored = scopes.enter(ScopeKind.CLASS, node.name())) {
 *     ...
 * }
 * }</pre>
 */
public class ScopeTracker {

    private final String moduleName;
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();

    public ScopeTracker(String moduleName) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName");
    }

    /** Push a frame named {@code <current qualified name>.<localName>}. */
    public Entered enter(ScopeKind kind, String localName) {
        Objects.requireNonNull(kind, "kind");
        if (kind == ScopeKind.MODULE) {
            throw new IllegalArgumentException("Module scope is implicit and cannot be entered");
        }
        if (localName == null || localName.isBlank()) {
            throw new IllegalArgumentException("Scope name must not be blank");
        }
        ScopeFrame frame = new ScopeFrame(kind, qualifiedName() + "." + localName);
        frames.push(frame);
        return new Entered(frame);
    }

    /** Pop the innermost frame. */
    public ScopeFrame exit() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Scope exit without matching enter in module " + moduleName);
        }
        return frames.pop();
    }

    public ScopeKind currentScopeKind() {
        ScopeFrame top = frames.peek();
        return top == null ? ScopeKind.MODULE : top.kind();
    }

    public boolean isDirectlyInsideClass() {
        return currentScopeKind() == ScopeKind.CLASS;
    }

    public String qualifiedName() {
        ScopeFrame top = frames.peek();
        return top == null ? moduleName : top.qualifiedName();
    }

    public String moduleName() {
        return moduleName;
    }

    public int depth() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /** Handle for an entered scope; closing it pops that frame, which must be the innermost. */
    public final class Entered implements AutoCloseable {
        private final ScopeFrame frame;
        private boolean closed;

        private Entered(ScopeFrame frame) {
            this.frame = frame;
        }

        public ScopeFrame frame() {
            return frame;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (frames.peek() != frame) {
                throw new IllegalStateException("Scope " + frame.qualifiedName() + " closed out of order");
            }
            closed = true;
            exit();
        }
    }
}
