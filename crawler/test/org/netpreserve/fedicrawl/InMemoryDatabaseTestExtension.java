package org.netpreserve.fedicrawl;

import org.junit.jupiter.api.extension.*;

/**
 * Injects an in-memory {@link Database} into test constructors. The database is shared by every test class in the
 * run, so tests clear the tables they use before each test.
 */
public class InMemoryDatabaseTestExtension implements BeforeAllCallback, ParameterResolver {

    private static Database sharedDatabase;

    @Override
    public void beforeAll(ExtensionContext context) {
        synchronized (InMemoryDatabaseTestExtension.class) {
            if (sharedDatabase == null) {
                sharedDatabase = Database.newDatabaseInMemory();
                context.getRoot().getStore(ExtensionContext.Namespace.GLOBAL)
                        .put(Database.class.getName(), (ExtensionContext.Store.CloseableResource) () -> {
                            sharedDatabase.close();
                            sharedDatabase = null;
                        });
            }
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == Database.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return sharedDatabase;
    }
}
