package com.ovsdb.modelgen.validation;

import com.sun.source.util.JavacTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Checks that source text is a syntactically valid Java compilation unit.
 *
 * Runs only the parse phase of the JDK compiler: names are not resolved, so
 * generated code may refer to types that are not on the class path.
 */
public class JavaSyntaxValidator {
    private static final Logger log = LoggerFactory.getLogger(JavaSyntaxValidator.class);

    private static final List<String> OPTIONS = List.of("-proc:none");

    /**
     * Parses the source and returns one message per syntax error.
     *
     * @param fileName name reported in diagnostics, e.g. "Bridge.java"
     * @return syntax errors, empty when the source is valid
     * @throws IllegalStateException when running on a JRE without a compiler
     */
    public List<String> validate(String source, String fileName) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No system Java compiler available; run on a JDK");
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        JavaFileObject file = new StringSource(fileName, source);
        try (StandardJavaFileManager fileManager =
                     compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            JavacTask task = (JavacTask) compiler.getTask(null, fileManager, diagnostics, OPTIONS, null, List.of(file));
            task.parse();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse in-memory source " + fileName, e);
        }

        List<String> errors = diagnostics.getDiagnostics().stream()
                .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                .map(d -> describe(fileName, d))
                .toList();
        if (!errors.isEmpty()) {
            log.debug("{} has {} syntax error(s)", fileName, errors.size());
        }
        return errors;
    }

    private static String describe(String fileName, Diagnostic<? extends JavaFileObject> diagnostic) {
        return fileName + ":" + diagnostic.getLineNumber() + ":" + diagnostic.getColumnNumber()
                + ": " + diagnostic.getMessage(Locale.ROOT);
    }

    private static final class StringSource extends SimpleJavaFileObject {

        private final String source;

        StringSource(String fileName, String source) {
            super(URI.create("string:///" + fileName), Kind.SOURCE);
            this.source = source;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return source;
        }
    }
}
