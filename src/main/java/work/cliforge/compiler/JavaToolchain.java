package work.cliforge.compiler;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;
import java.util.stream.Stream;
import javax.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles generated source with the JDK's system compiler and packages it as an executable jar
 * whose manifest points at the libraries on {@code classpath}.
 */
public final class JavaToolchain {
    private static final Logger LOG = LoggerFactory.getLogger(JavaToolchain.class);

    private final String classpath;

    public JavaToolchain() {
        this(System.getProperty("java.class.path", ""));
    }

    public JavaToolchain(String classpath) {
        this.classpath = classpath == null ? "" : classpath;
    }

    /**
     * Compiles {@code source} into {@code outputDirectory/classes} and writes
     * {@code outputDirectory/<jarName>.jar}.
     *
     * @return the jar path
     */
    public Path build(GeneratedSource source, Path outputDirectory, String jarName) {
        var compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new BuildException("no system Java compiler available (a JDK is required)", "");
        }
        try {
            var sourceDir = Files.createDirectories(outputDirectory.resolve("src"));
            var classesDir = Files.createDirectories(outputDirectory.resolve("classes"));
            var sourceFile = sourceDir.resolve(source.fileName());
            Files.writeString(sourceFile, source.source(), StandardCharsets.UTF_8);

            var diagnostics = new StringWriter();
            try (var fileManager = compiler.getStandardFileManager(null, null, StandardCharsets.UTF_8)) {
                var units = fileManager.getJavaFileObjects(sourceFile.toFile());
                var options = List.of("-d", classesDir.toString(), "-classpath", classpath, "-encoding", "UTF-8");
                LOG.debug("Compiling {} into {}", sourceFile, classesDir);
                boolean ok = compiler.getTask(diagnostics, fileManager, null, options, null, units).call();
                if (!ok) {
                    throw new BuildException("compilation of " + source.className() + " failed", diagnostics.toString());
                }
            }

            var jar = outputDirectory.resolve(jarName + ".jar");
            writeJar(jar, classesDir, source.className());
            LOG.info("Built {}", jar);
            return jar;
        } catch (IOException ex) {
            throw new BuildException("unable to build " + source.className() + ": " + ex.getMessage(), ex);
        }
    }

    private void writeJar(Path jar, Path classesDir, String mainClass) throws IOException {
        var manifest = new Manifest();
        var attributes = manifest.getMainAttributes();
        attributes.put(Attributes.Name.MANIFEST_VERSION, "1.0");
        attributes.put(Attributes.Name.MAIN_CLASS, mainClass);
        var manifestClasspath = manifestClasspath();
        if (!manifestClasspath.isEmpty()) {
            attributes.put(Attributes.Name.CLASS_PATH, manifestClasspath);
        }

        List<Path> classFiles = new ArrayList<>();
        try (Stream<Path> files = Files.walk(classesDir)) {
            files.filter(Files::isRegularFile).sorted().forEach(classFiles::add);
        }
        try (var out = new JarOutputStream(Files.newOutputStream(jar), manifest)) {
            for (var file : classFiles) {
                var entryName = classesDir.relativize(file).toString().replace(File.separatorChar, '/');
                out.putNextEntry(new JarEntry(entryName));
                Files.copy(file, out);
                out.closeEntry();
            }
        }
    }

    /**
     * Absolute {@code file:} URLs, directories with a trailing slash, as the jar manifest expects.
     */
    private String manifestClasspath() {
        var entries = new StringJoiner(" ");
        for (var element : classpath.split(File.pathSeparator)) {
            if (element.isBlank()) {
                continue;
            }
            var path = Path.of(element).toAbsolutePath();
            entries.add(path.toUri().toString());
        }
        return entries.toString();
    }
}
