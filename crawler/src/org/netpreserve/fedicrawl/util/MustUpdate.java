package org.netpreserve.fedicrawl.util;

import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.StatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizerFactory;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizingAnnotation;

import java.lang.annotation.*;
import java.lang.reflect.Method;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Fails a SQL object method whose statement changed an unexpected number of rows.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(value = MustUpdate.Handler.class)
public @interface MustUpdate {
    /**
     * Exact number of rows the statement must change, or -1 for "at least one".
     */
    int value() default -1;

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            int expected = ((MustUpdate) annotation).value();
            String name = method.getDeclaringClass().getSimpleName() + "." + method.getName() + "()";
            return stmt -> stmt.addCustomizer(new StatementCustomizer() {
                @Override
                public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws SQLException {
                    long updateCount = stmt.getUpdateCount();
                    if (expected == -1 && updateCount == 0) {
                        throw new Exception(name + " didn't change any rows");
                    } else if (expected != -1 && updateCount != expected) {
                        throw new Exception(name + " expected to change " + expected + " rows but changed " + updateCount);
                    }
                }
            });
        }
    }

    class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }
    }
}
