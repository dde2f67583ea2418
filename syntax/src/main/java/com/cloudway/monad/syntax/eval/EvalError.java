/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.monad.syntax.eval;

import com.cloudway.monad.syntax.Expr;

@SuppressWarnings("serial")
public class EvalError extends RuntimeException {
    public EvalError(String message) {
        super(message);
    }

    protected EvalError() {
    }

    public EvalError(Throwable cause) {
        super(cause);
    }

    @Override
    public String getMessage() {
        return "Error: " + getRawMessage();
    }

    protected String getRawMessage() {
        return super.getMessage();
    }

    static String show(Object value) {
        return value instanceof Expr ? ((Expr)value).show() : String.valueOf(value);
    }

    public static class Unbound extends EvalError {
        public final String name;

        public Unbound(String name) {
            this.name = name;
        }

        @Override
        public String getRawMessage() {
            return "unbound variable: " + name;
        }
    }

    public static class NotAFunction extends EvalError {
        public final Object found;

        public NotAFunction(Object found) {
            this.found = found;
        }

        @Override
        public String getRawMessage() {
            return "attempt to apply non-function " + show(found);
        }
    }

    public static class NumArgs extends EvalError {
        public final int expected;
        public final int found;

        public NumArgs(int expected, int found) {
            this.expected = expected;
            this.found = found;
        }

        @Override
        public String getRawMessage() {
            return "expected " + expected + " args; found " + found;
        }
    }

    public static class TypeMismatch extends EvalError {
        public final String expected;
        public final Object found;

        public TypeMismatch(String expected, Object found) {
            this.expected = expected;
            this.found = found;
        }

        @Override
        public String getRawMessage() {
            return "invalid type: expected " + expected + ", found " + show(found);
        }
    }

    public static class PatternMismatch extends EvalError {
        public final Expr pattern;
        public final Object found;

        public PatternMismatch(Expr pattern, Object found) {
            this.pattern = pattern;
            this.found = found;
        }

        @Override
        public String getRawMessage() {
            return "pattern mismatch: pattern " + pattern.show() + ", found " + show(found);
        }
    }

    public static class BadForm extends EvalError {
        public final String message;
        public final Expr form;

        public BadForm(String message, Expr form) {
            this.message = message;
            this.form = form;
        }

        @Override
        public String getRawMessage() {
            return message + ": " + form.show();
        }
    }
}
