package skein;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.google.common.io.Files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CompilerMain {
  private static final Logger LOGGER = LoggerFactory.getLogger(CompilerMain.class);

  private static final String EXTENSION = ".skein";
  private static final String STRINGS_ONLY_FLAG = "--strings-only";

  public static void main(String[] args) throws IOException {
    CompilationJob.CompilationType compilationType =
        CompilationJob.CompilationType.FULL_COMPILATION;
    List<File> files = new ArrayList<>();
    for (String arg : args) {
      if (arg.equals(STRINGS_ONLY_FLAG)) {
        compilationType = CompilationJob.CompilationType.STRINGS_ONLY;
      } else {
        files.addAll(getFiles(new File(arg)));
      }
    }

    if (files.isEmpty()) {
      System.err.println("Usage: $COMPILER [" + STRINGS_ONLY_FLAG + "] skein_file_or_dir...");
      System.exit(1);
    }

    CompilationJob.Builder job = CompilationJob.builder().setCompilationType(compilationType);
    for (File f : files) {
      LOGGER.info("Reading {}", f);
      job.addFile(f.getName(), read(f));
    }

    CompilationResult result = Compiler.compile(job.build());
    LOGGER.info("Compiled {} file(s): {}", files.size(), result.summary());
    result.diagnostics().forEach(Diagnostic::print);

    if (compilationType == CompilationJob.CompilationType.FULL_COMPILATION) {
      for (Declaration declaration : result.declarations()) {
        System.out.println(
            String.format(
                "%s: %s = %s%s",
                declaration.name(),
                declaration.type(),
                declaration.defaultValue(),
                declaration.description().map(d -> " (" + d + ")").orElse("")));
      }
    }
    for (Map.Entry<String, StringInfo> entry : result.stringTable().entrySet()) {
      System.out.println(String.format("%s: %s", entry.getKey(), entry.getValue().text()));
    }

    if (result.hasErrors()) {
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }
    System.out.println("Compilation succeeded!");
  }

  // A file as-is, or the .skein files directly inside a directory.
  private static List<File> getFiles(File file) {
    if (!file.isDirectory()) return Arrays.asList(file);

    File[] children = file.listFiles();
    if (children == null) return new ArrayList<>();
    return Arrays.asList(children)
        .stream()
        .filter(f -> f.isFile() && f.getName().endsWith(EXTENSION))
        .sorted(Comparator.comparing(File::getName))
        .collect(Collectors.toList());
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
