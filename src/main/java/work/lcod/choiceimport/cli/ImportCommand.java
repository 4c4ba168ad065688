package work.lcod.choiceimport.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import picocli.CommandLine;
import work.lcod.choiceimport.api.ImportConfiguration;
import work.lcod.choiceimport.api.ImportRunner;
import work.lcod.choiceimport.api.LogLevel;
import work.lcod.choiceimport.api.RunResult;
import work.lcod.choiceimport.engine.ChoiceEngine;
import work.lcod.choiceimport.shared.SynonymTable;

@CommandLine.Command(
    name = "lcod-choice-import",
    description = "Import a builder character export into catalog level choices.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ImportCommand implements Callable<Integer> {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    private record ConfigFile(
        Optional<Integer> maxDepth,
        Optional<Integer> levelCap,
        Optional<String> logLevel,
        Map<String, String> translations
    ) {
        static ConfigFile empty() {
            return new ConfigFile(Optional.empty(), Optional.empty(), Optional.empty(), Map.of());
        }
    }

    @CommandLine.Option(
        names = {"-c", "--catalog"},
        required = true,
        paramLabel = "PATH",
        description = "Catalog document (JSON, or YAML with a .yaml/.yml extension)."
    )
    private Path catalog;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        description = "Character JSON file; use '-' to read from stdin.",
        defaultValue = "-"
    )
    private String input;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "TOML file with an [import] table (max-depth, level-cap, log-level) and optional [translations].",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--level-cap",
        description = "Expand catalog features up to this level instead of the class level.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer levelCap;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Maximum nesting followed in source and catalog trees (default: " + ChoiceEngine.DEFAULT_MAX_DEPTH + ").",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        ConfigFile file = loadConfigFile();
        LogLevel logLevel = resolveLogLevel(file);
        // slf4j-simple reads its level once, when the first logger is created.
        System.setProperty(SIMPLE_LOGGER_LEVEL, logLevel.simpleLoggerName());

        ImportConfiguration configuration = ImportConfiguration.builder()
            .catalogPath(catalog.toAbsolutePath().normalize())
            .inputPayload(loadInputPayload())
            .levelCap(Optional.ofNullable(levelCap).or(file::levelCap))
            .maxDepth(Optional.ofNullable(maxDepth).or(file::maxDepth).orElse(ChoiceEngine.DEFAULT_MAX_DEPTH))
            .logLevel(logLevel)
            .synonyms(file.translations())
            .build();

        RunResult result = new ImportRunner().run(configuration);
        System.out.println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private ConfigFile loadConfigFile() {
        if (config == null) {
            return ConfigFile.empty();
        }
        Path path = config.toAbsolutePath().normalize();
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Cannot read config file: " + path);
        }
        if (result.hasErrors()) {
            throw new CommandLine.ParameterException(
                new CommandLine(this),
                "Invalid config file " + path + ": " + result.errors().get(0).toString()
            );
        }
        TomlTable importTable = result.getTable("import");
        if (importTable == null) {
            return new ConfigFile(Optional.empty(), Optional.empty(), Optional.empty(), SynonymTable.readTable(result.getTable("translations")));
        }
        return new ConfigFile(
            Optional.ofNullable(importTable.getLong("max-depth")).map(Long::intValue),
            Optional.ofNullable(importTable.getLong("level-cap")).map(Long::intValue),
            Optional.ofNullable(importTable.getString("log-level")),
            SynonymTable.readTable(result.getTable("translations"))
        );
    }

    private LogLevel resolveLogLevel(ConfigFile file) {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = file.logLevel().orElse(null);
        }
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("LCOD_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage());
        }
    }

    private String loadInputPayload() {
        if (input == null || input.isBlank() || "-".equals(input)) {
            return readStdin();
        }
        Path path = Paths.get(input).toAbsolutePath().normalize();
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Cannot read input file: " + path);
        }
    }

    private String readStdin() {
        try {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(new CommandLine(this), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
