/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax;

/**
 * Reports a malformed do-block or pipeline. Raised while the code is
 * being composed and never recovered from.
 */
@SuppressWarnings("serial")
public class SyntaxError extends RuntimeException {
    public SyntaxError(String message) {
        super(message);
    }

    protected SyntaxError() {
    }

    @Override
    public String getMessage() {
        return "Syntax error: " + getRawMessage();
    }

    protected String getRawMessage() {
        return super.getMessage();
    }

    public static class MissingBlock extends SyntaxError {
        public final Strategy strategy;

        public MissingBlock(Strategy strategy) {
            this.strategy = strategy;
        }

        @Override
        public String getRawMessage() {
            return "missing block in do-block for " + strategy;
        }
    }

    public static class BadStatement extends SyntaxError {
        public final String message;
        public final Stmt stmt;

        public BadStatement(String message, Stmt stmt) {
            this.message = message;
            this.stmt = stmt;
        }

        @Override
        public String getRawMessage() {
            return message + ": " + stmt.show();
        }
    }

    public static class BadPipeline extends SyntaxError {
        public final String message;
        public final Expr form;

        public BadPipeline(String message, Expr form) {
            this.message = message;
            this.form = form;
        }

        @Override
        public String getRawMessage() {
            return message + ": " + form.show();
        }
    }
}
