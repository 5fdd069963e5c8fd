package com.coderelay.test;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * JUnit 5 extension that gives each test a fresh SQLite database file inside a
 * temporary directory, removed after the test.
 *
 * <pre>
 * {@code
 * @ExtendWith(TempDatabaseExtension.class)
 * class MyTest {
 *     @Test
 *     void test(@TempDatabase Path database) { ... }
 * }
 * }
 * </pre>
 */
public class TempDatabaseExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver {

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(TempDatabaseExtension.class);
    private static final String TEMP_DIR_KEY = "coderelay.test.tempDir";
    private static final String DATABASE_FILE = "coderelay.db";

    @Override
    public void beforeEach(ExtensionContext context) throws IOException {
        String testName = context.getRequiredTestClass().getSimpleName();
        Path tempDir = Files.createTempDirectory("coderelay-test-" + testName + "-");
        context.getStore(NAMESPACE).put(TEMP_DIR_KEY, tempDir);
    }

    @Override
    public void afterEach(ExtensionContext context) throws IOException {
        Path tempDir = context.getStore(NAMESPACE).remove(TEMP_DIR_KEY, Path.class);
        if (tempDir != null && Files.exists(tempDir)) {
            deleteDirectory(tempDir);
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.isAnnotated(TempDatabase.class)
                && parameterContext.getParameter().getType() == Path.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Path tempDir = extensionContext.getStore(NAMESPACE).get(TEMP_DIR_KEY, Path.class);
        if (tempDir == null) {
            throw new ParameterResolutionException("@TempDatabase is only available to test methods");
        }
        return tempDir.resolve(DATABASE_FILE);
    }

    private static void deleteDirectory(Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
