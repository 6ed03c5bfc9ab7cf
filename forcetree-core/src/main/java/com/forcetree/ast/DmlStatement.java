package com.forcetree.ast;

import java.util.List;

/**
 * A DML statement such as {@code insert as user records;}.
 */
public abstract sealed class DmlStatement extends Statement permits
    DmlStatement.Insert,
    DmlStatement.Update,
    DmlStatement.Delete,
    DmlStatement.Undelete,
    DmlStatement.Upsert,
    DmlStatement.Merge {

    public enum AccessLevel {
        USER_MODE,
        SYSTEM_MODE
    }

    private final Expression value;
    private final AccessLevel access;

    protected DmlStatement(Expression value, AccessLevel access, SourceLocation loc) {
        super(loc);
        this.value = value;
        this.access = access;
    }

    public Expression value() {
        return value;
    }

    /**
     * The declared access level, or null when none is written.
     */
    public AccessLevel access() {
        return access;
    }

    @Override
    protected List<Node> childNodes() {
        return List.of(value);
    }

    public static final class Insert extends DmlStatement {
        public Insert(Expression value, AccessLevel access, SourceLocation loc) {
            super(value, access, loc);
        }
    }

    public static final class Update extends DmlStatement {
        public Update(Expression value, AccessLevel access, SourceLocation loc) {
            super(value, access, loc);
        }
    }

    public static final class Delete extends DmlStatement {
        public Delete(Expression value, AccessLevel access, SourceLocation loc) {
            super(value, access, loc);
        }
    }

    public static final class Undelete extends DmlStatement {
        public Undelete(Expression value, AccessLevel access, SourceLocation loc) {
            super(value, access, loc);
        }
    }

    /**
     * {@code upsert records Field__c;}. The external id field is optional.
     */
    public static final class Upsert extends DmlStatement {
        private final Identifier field;

        public Upsert(
            Expression value,
            Identifier field,  // Can be null
            AccessLevel access,
            SourceLocation loc
        ) {
            super(value, access, loc);
            this.field = field;
        }

        public Identifier field() {
            return field;
        }

        @Override
        protected List<Node> childNodes() {
            return listOf(value(), field);
        }
    }

    /**
     * {@code merge master duplicate;}.
     */
    public static final class Merge extends DmlStatement {
        private final Expression from;

        public Merge(Expression value, Expression from, AccessLevel access, SourceLocation loc) {
            super(value, access, loc);
            this.from = from;
        }

        public Expression from() {
            return from;
        }

        @Override
        protected List<Node> childNodes() {
            return List.of(value(), from);
        }
    }
}
