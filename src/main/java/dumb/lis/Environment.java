package dumb.lis;

import dumb.lis.EvaluatorException.UnboundVariable;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A chain of binding frames, innermost first. Frames are shared by reference
 * between the environment that created them, environments extended from it and
 * every procedure that captured it, so a mutation is seen through all of them.
 */
public class Environment {

    private final Map<String, Term> frame;
    private final @Nullable Environment parent;

    public Environment() {
        this(new HashMap<>(), null);
    }

    private Environment(Map<String, Term> frame, @Nullable Environment parent) {
        this.frame = frame;
        this.parent = parent;
    }

    public Term lookup(String name) {
        for (var e = this; e != null; e = e.parent) {
            var value = e.frame.get(name);
            if (value != null) return value;
        }
        throw new UnboundVariable(name);
    }

    /** Binds {@code name} in the innermost frame, shadowing any outer binding. */
    public void define(String name, Term value) {
        frame.put(name, value);
    }

    /** Overwrites the binding of {@code name} in the frame that holds it. */
    public void mutate(String name, Term value) {
        for (var e = this; e != null; e = e.parent) {
            if (e.frame.containsKey(name)) {
                e.frame.put(name, value);
                return;
            }
        }
        throw new UnboundVariable(name);
    }

    public void update(Map<String, ? extends Term> bindings) {
        frame.putAll(bindings);
    }

    public Environment extend(Map<String, Term> bindings) {
        return new Environment(new HashMap<>(bindings), this);
    }

    public Environment extend() {
        return new Environment(new HashMap<>(), this);
    }

    public boolean contains(String name) {
        for (var e = this; e != null; e = e.parent) {
            if (e.frame.containsKey(name)) return true;
        }
        return false;
    }

    public Map<String, Term> frame() {
        return Collections.unmodifiableMap(frame);
    }

    public @Nullable Environment parent() {
        return parent;
    }
}
