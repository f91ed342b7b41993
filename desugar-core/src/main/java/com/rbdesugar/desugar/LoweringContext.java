package com.rbdesugar.desugar;

import com.rbdesugar.ast.SourceLocation;
import com.rbdesugar.errors.CollectingDiagnosticSink;
import com.rbdesugar.errors.Diagnostic;
import com.rbdesugar.errors.DiagnosticSink;
import com.rbdesugar.errors.ErrorClass;
import com.rbdesugar.errors.LoweringException;
import com.rbdesugar.names.Name;
import com.rbdesugar.names.NameTable;
import com.rbdesugar.verifier.BasicVerifier;
import com.rbdesugar.verifier.Verifier;

/**
 * Everything one compilation unit needs from its session: the shared name table, where
 * diagnostics go, the file being lowered and the verifier run on the result.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * LoweringContext ctx = LoweringContext.builder()
 *     .names(session.names())
 *     .diagnostics(sink)
 *     .file("app/models/user.rb")
 *     .build();
 * Expression tree = Desugar.node2Tree(ctx, parseTree);
 * }</pre>
 */
public final class LoweringContext {

    private final NameTable names;
    private final DiagnosticSink diagnostics;
    private final String file;
    private final Verifier verifier;

    private LoweringContext(Builder builder) {
        this.names = builder.names != null ? builder.names : new NameTable();
        this.diagnostics = builder.diagnostics != null ? builder.diagnostics : new CollectingDiagnosticSink();
        this.file = builder.file != null ? builder.file : "<unknown>";
        this.verifier = builder.verifier != null ? builder.verifier : new BasicVerifier();
    }

    public static Builder builder() {
        return new Builder();
    }

    public NameTable names() {
        return names;
    }

    public DiagnosticSink diagnostics() {
        return diagnostics;
    }

    public String file() {
        return file;
    }

    public Verifier verifier() {
        return verifier;
    }

    /**
     * Interns an identifier taken from the parse tree.
     *
     * @throws LoweringException if the parse tree left the identifier out
     */
    public Name intern(String text) {
        if (text == null) {
            throw new LoweringException("parse tree is missing an identifier");
        }
        return names.intern(text);
    }

    public void report(SourceLocation loc, ErrorClass what, String header) {
        diagnostics.report(new Diagnostic(loc, what, header));
    }

    public static final class Builder {
        private NameTable names;
        private DiagnosticSink diagnostics;
        private String file;
        private Verifier verifier;

        private Builder() {
        }

        public Builder names(NameTable names) {
            this.names = names;
            return this;
        }

        public Builder diagnostics(DiagnosticSink diagnostics) {
            this.diagnostics = diagnostics;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder verifier(Verifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public LoweringContext build() {
            return new LoweringContext(this);
        }
    }
}
