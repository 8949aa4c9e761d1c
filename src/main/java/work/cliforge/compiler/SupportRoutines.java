package work.cliforge.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import work.cliforge.plan.Feature;

/**
 * Source text of the members a generated program may carry. The command-tree routines are always
 * present; the rest only when their feature is used. Dispatch mirrors
 * {@code work.cliforge.runtime.PicocliBinding} and rendering mirrors
 * {@code work.cliforge.render.OutputRenderer}, since the generated program runs standalone.
 */
final class SupportRoutines {
    private SupportRoutines() {}

    static Set<String> imports(Set<Feature> features) {
        var imports = new TreeSet<String>(List.of(
            "java.io.PrintStream",
            "java.io.PrintWriter",
            "java.util.ArrayList",
            "java.util.Arrays",
            "java.util.LinkedHashMap",
            "java.util.List",
            "java.util.Map",
            "picocli.CommandLine",
            "picocli.CommandLine.Model.CommandSpec",
            "picocli.CommandLine.Model.OptionSpec",
            "picocli.CommandLine.Model.PositionalParamSpec",
            "picocli.CommandLine.ParseResult"
        ));
        if (features.contains(Feature.JSON_MAPPER)) {
            imports.add("com.fasterxml.jackson.core.JsonProcessingException");
            imports.add("com.fasterxml.jackson.databind.DeserializationFeature");
            imports.add("com.fasterxml.jackson.databind.ObjectMapper");
        }
        if (features.contains(Feature.JSON_OUTPUT)) {
            imports.add("com.fasterxml.jackson.core.JsonGenerator");
            imports.add("com.fasterxml.jackson.core.util.DefaultIndenter");
            imports.add("com.fasterxml.jackson.core.util.DefaultPrettyPrinter");
        }
        if (features.contains(Feature.JSON_OUTPUT) || features.contains(Feature.HTTP_STEP)) {
            imports.add("java.io.IOException");
        }
        if (features.contains(Feature.HTTP_STEP)) {
            imports.add("java.net.URI");
            imports.add("java.net.http.HttpClient");
            imports.add("java.net.http.HttpRequest");
            imports.add("java.net.http.HttpResponse");
            imports.add("java.time.Duration");
        }
        if (features.contains(Feature.TABLE_OUTPUT)) {
            imports.add("java.util.StringJoiner");
        }
        return imports;
    }

    static List<String> fields(Set<Feature> features) {
        var fields = new ArrayList<String>();
        if (features.contains(Feature.JSON_MAPPER)) {
            fields.add("private static final ObjectMapper JSON =\n"
                + "    new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);");
        }
        if (features.contains(Feature.HTTP_STEP)) {
            fields.add("private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);");
            fields.add("private static final HttpClient HTTP =\n"
                + "    HttpClient.newBuilder()\n"
                + "        .followRedirects(HttpClient.Redirect.NORMAL)\n"
                + "        .connectTimeout(REQUEST_TIMEOUT)\n"
                + "        .build();");
        }
        return fields;
    }

    static List<String> members(Set<Feature> features) {
        var members = new ArrayList<String>();
        members.add(COMMAND_TREE);
        if (features.contains(Feature.ENV_FALLBACK)) {
            members.add(ENV_OR);
        }
        if (features.contains(Feature.ARG_LOOKUP)) {
            members.add(ARG);
        }
        if (features.contains(Feature.STEP_PATH)) {
            members.add(PATH);
        }
        if (features.contains(Feature.OBJECT_LITERAL)) {
            members.add(MAP_OF);
        }
        if (features.contains(Feature.JSON_ENCODE)) {
            members.add(TO_JSON);
        }
        if (features.contains(Feature.HTTP_STEP)) {
            members.add(HTTP_STEP);
        }
        if (features.contains(Feature.JSON_OUTPUT)) {
            members.add(RENDER_JSON);
        }
        if (features.contains(Feature.TABLE_OUTPUT)) {
            members.add(RENDER_TABLE);
        }
        if (features.contains(Feature.TEXT_OUTPUT)) {
            members.add(RENDER_TEXT);
        }
        return members;
    }

    private static final String COMMAND_TREE = """
        @FunctionalInterface
        private interface Handler {
          void run(Map<String, String> flags, List<String> args, PrintStream out) throws Exception;
        }

        private record Flag(
            String name, String shortName, String description, String defaultValue, boolean required) {}

        private record Leaf(String usage, List<Flag> locals, int required, boolean exact, Handler handler) {}

        private static CommandSpec group(
            String name, String usage, String description, List<Flag> globals, List<Flag> locals) {
          return describe(CommandSpec.create(), name, usage, description, globals, locals);
        }

        private static CommandSpec leaf(
            String name,
            String usage,
            String description,
            List<Flag> globals,
            List<Flag> locals,
            int required,
            boolean exact,
            Handler handler) {
          CommandSpec spec =
              CommandSpec.wrapWithoutInspection(new Leaf(usage, locals, required, exact, handler));
          describe(spec, name, usage, description, globals, locals);
          spec.addPositional(
              PositionalParamSpec.builder()
                  .arity("0..*")
                  .type(String[].class)
                  .paramLabel("ARGS")
                  .hidden(true)
                  .build());
          return spec;
        }

        private static CommandSpec describe(
            CommandSpec spec,
            String name,
            String usage,
            String description,
            List<Flag> globals,
            List<Flag> locals) {
          spec.name(name);
          spec.mixinStandardHelpOptions(true);
          spec.usageMessage().customSynopsis(usage);
          if (!description.isEmpty()) {
            spec.usageMessage().description(description);
          }
          for (Flag flag : globals) {
            spec.addOption(option(flag, false));
          }
          for (Flag flag : locals) {
            spec.addOption(option(flag, flag.required()));
          }
          return spec;
        }

        private static OptionSpec option(Flag flag, boolean required) {
          List<String> names = new ArrayList<>();
          if (flag.shortName() != null) {
            names.add("-" + flag.shortName());
          }
          names.add("--" + flag.name());
          return OptionSpec.builder(names.toArray(new String[0]))
              .type(String.class)
              .arity("1")
              .paramLabel("<" + flag.name() + ">")
              .description(flag.description())
              .required(required)
              .build();
        }

        private static int execute(
            CommandSpec root, List<Flag> globals, PrintStream out, PrintStream err, String... args) {
          CommandLine commandLine = new CommandLine(root);
          commandLine.setInterpolateVariables(false);
          commandLine.setOut(new PrintWriter(out, true));
          commandLine.setErr(new PrintWriter(err, true));
          commandLine.setExecutionStrategy(parseResult -> dispatch(parseResult, globals, out));
          commandLine.setExecutionExceptionHandler(
              (ex, failed, parseResult) -> {
                String message = ex.getMessage();
                failed.getErr().println(message == null || message.isBlank() ? ex.toString() : message);
                return failed.getCommandSpec().exitCodeOnExecutionException();
              });
          return commandLine.execute(args);
        }

        private static int dispatch(ParseResult parseResult, List<Flag> globals, PrintStream out) {
          Integer helpExitCode = CommandLine.executeHelpRequest(parseResult);
          if (helpExitCode != null) {
            return helpExitCode;
          }
          List<ParseResult> chain = new ArrayList<>();
          ParseResult current = parseResult;
          chain.add(current);
          while (current.hasSubcommand()) {
            current = current.subcommand();
            chain.add(current);
          }
          CommandLine commandLine = current.commandSpec().commandLine();
          Map<String, String> flags = new LinkedHashMap<>();
          List<String> supplied = new ArrayList<>();
          for (Flag flag : globals) {
            flags.put(flag.name(), flag.defaultValue());
            for (int i = chain.size() - 1; i >= 0; i--) {
              if (chain.get(i).hasMatchedOption("--" + flag.name())) {
                flags.put(flag.name(), chain.get(i).matchedOptionValue("--" + flag.name(), ""));
                supplied.add(flag.name());
                break;
              }
            }
          }
          if (!(current.commandSpec().userObject() instanceof Leaf leaf)) {
            commandLine.usage(commandLine.getOut());
            return 0;
          }
          for (Flag flag : globals) {
            if (flag.required() && !supplied.contains(flag.name())) {
              throw new CommandLine.ParameterException(
                  commandLine, "Missing required option: '--" + flag.name() + "'");
            }
          }
          for (Flag flag : leaf.locals()) {
            flags.put(
                flag.name(),
                current.hasMatchedOption("--" + flag.name())
                    ? current.matchedOptionValue("--" + flag.name(), "")
                    : flag.defaultValue());
          }
          String[] positionals = current.matchedPositionalValue(0, new String[0]);
          List<String> args = Arrays.asList(positionals);
          if (leaf.exact() && args.size() != leaf.required()) {
            throw new CommandLine.ParameterException(
                commandLine,
                leaf.usage()
                    + ": "
                    + String.format("accepts %d arg(s), received %d", leaf.required(), args.size()));
          }
          if (!leaf.exact() && args.size() < leaf.required()) {
            throw new CommandLine.ParameterException(
                commandLine,
                leaf.usage()
                    + ": "
                    + String.format(
                        "requires at least %d arg(s), only received %d", leaf.required(), args.size()));
          }
          try {
            leaf.handler().run(flags, args, out);
          } catch (Exception e) {
            throw new CommandLine.ExecutionException(commandLine, e.getMessage(), e);
          }
          return 0;
        }
        """;

    private static final String ENV_OR = """
        private static String envOr(String name, String fallback) {
          String value = System.getenv(name);
          return value == null || value.isEmpty() ? fallback : value;
        }
        """;

    private static final String ARG = """
        private static String arg(List<String> args, int position) {
          return position < args.size() ? args.get(position) : null;
        }
        """;

    private static final String PATH = """
        private static Object path(Object value, String... keys) {
          Object current = value;
          for (String key : keys) {
            if (!(current instanceof Map<?, ?> map)) {
              return null;
            }
            current = map.get(key);
          }
          return current;
        }
        """;

    private static final String MAP_OF = """
        private static Map<String, Object> mapOf(Object... entries) {
          Map<String, Object> map = new LinkedHashMap<>();
          for (int i = 0; i < entries.length; i += 2) {
            map.put((String) entries[i], entries[i + 1]);
          }
          return map;
        }
        """;

    private static final String TO_JSON = """
        private static String toJson(Object value) throws JsonProcessingException {
          return JSON.writeValueAsString(value);
        }
        """;

    private static final String HTTP_STEP = """
        private static IllegalStateException stepFailure(String step, Exception e) {
          String message = e.getMessage();
          return new IllegalStateException(
              "step \\"" + step + "\\" failed: "
                  + (message == null || message.isBlank() ? e.toString() : message),
              e);
        }

        private static Object httpStep(String method, Object url, Object headers, Object body)
            throws Exception {
          HttpRequest.Builder builder =
              HttpRequest.newBuilder(URI.create(String.valueOf(url))).timeout(REQUEST_TIMEOUT);
          if (headers instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> header : map.entrySet()) {
              builder.header(String.valueOf(header.getKey()), String.valueOf(header.getValue()));
            }
          } else if (headers != null) {
            throw new IllegalArgumentException("headers must resolve to an object");
          }
          HttpRequest.BodyPublisher publisher =
              body == null
                  ? HttpRequest.BodyPublishers.noBody()
                  : HttpRequest.BodyPublishers.ofString(
                      body instanceof String text ? text : JSON.writeValueAsString(body));
          builder.method(method, publisher);
          HttpResponse<String> response = HTTP.send(builder.build(), HttpResponse.BodyHandlers.ofString());
          if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("HTTP " + response.statusCode() + ": " + response.body());
          }
          Map<String, Object> result = new LinkedHashMap<>();
          result.put("body", parseBody(response.body()));
          result.put("status", response.statusCode());
          return result;
        }

        private static Object parseBody(String text) {
          if (text == null || text.isEmpty()) {
            return null;
          }
          try {
            return JSON.readValue(text, Object.class);
          } catch (JsonProcessingException notJson) {
            return text;
          }
        }
        """;

    private static final String RENDER_JSON = """
        private static final class JsonPrinter extends DefaultPrettyPrinter {
          JsonPrinter() {
            indentObjectsWith(new DefaultIndenter("  ", "\\n"));
            indentArraysWith(new DefaultIndenter("  ", "\\n"));
          }

          @Override
          public DefaultPrettyPrinter createInstance() {
            return new JsonPrinter();
          }

          @Override
          public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
          }
        }

        private static void renderJson(PrintStream out, Object data) throws JsonProcessingException {
          out.print(JSON.writer(new JsonPrinter()).writeValueAsString(data) + "\\n");
          out.flush();
        }
        """;

    private static final String RENDER_TABLE = """
        private static void renderTable(PrintStream out, Object data, List<String> columns) {
          if (!(data instanceof List<?> rows)) {
            throw new IllegalArgumentException("table output requires an array");
          }
          List<String> effective = new ArrayList<>(columns);
          if (effective.isEmpty() && !rows.isEmpty() && rows.get(0) instanceof Map<?, ?> first) {
            for (Object key : first.keySet()) {
              effective.add(String.valueOf(key));
            }
          }
          if (effective.isEmpty()) {
            return;
          }
          StringBuilder text = new StringBuilder(String.join("\\t", effective)).append('\\n');
          for (Object row : rows) {
            if (!(row instanceof Map<?, ?> fields)) {
              continue;
            }
            StringJoiner line = new StringJoiner("\\t");
            for (String column : effective) {
              line.add(fields.containsKey(column) ? String.valueOf(fields.get(column)) : "");
            }
            text.append(line).append('\\n');
          }
          out.print(text);
          out.flush();
        }
        """;

    private static final String RENDER_TEXT = """
        private static void renderText(PrintStream out, Object data) {
          out.print(String.valueOf(data) + "\\n");
          out.flush();
        }
        """;
}
