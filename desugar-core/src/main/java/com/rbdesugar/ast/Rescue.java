package com.rbdesugar.ast;

import java.util.ArrayList;
import java.util.List;

public record Rescue(
    SourceLocation loc,
    Expression body,
    List<RescueCase> rescueCases,
    Expression elsep,
    Expression ensure
) implements Expression {

    public Rescue {
        rescueCases = List.copyOf(rescueCases);
    }

    public static Builder builder(SourceLocation loc) {
        return new Builder(loc);
    }

    /**
     * Starts a builder that takes over everything {@code rescue} holds, so that a missing part
     * (usually the ensure branch) can be filled in.
     */
    public static Builder from(Rescue rescue) {
        Builder builder = new Builder(rescue.loc());
        builder.body = rescue.body();
        builder.rescueCases.addAll(rescue.rescueCases());
        builder.elsep = rescue.elsep();
        builder.ensure = rescue.ensure();
        return builder;
    }

    @Override
    public String type() {
        return "Rescue";
    }

    public static final class Builder {
        private final SourceLocation loc;
        private final List<RescueCase> rescueCases = new ArrayList<>();
        private Expression body;
        private Expression elsep;
        private Expression ensure;

        private Builder(SourceLocation loc) {
            this.loc = loc;
        }

        public Builder body(Expression body) {
            this.body = body;
            return this;
        }

        public Builder rescueCase(RescueCase rescueCase) {
            this.rescueCases.add(rescueCase);
            return this;
        }

        public Builder elsep(Expression elsep) {
            this.elsep = elsep;
            return this;
        }

        public Builder ensure(Expression ensure) {
            this.ensure = ensure;
            return this;
        }

        public Rescue build() {
            return new Rescue(
                loc,
                body != null ? body : new EmptyTree(loc),
                rescueCases,
                elsep != null ? elsep : new EmptyTree(loc),
                ensure != null ? ensure : new EmptyTree(loc));
        }
    }
}
