package app.ankillm.cli;

import app.ankillm.config.GenerationProps;
import app.ankillm.config.UserConfigStore;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.QualityCheckConfig;
import app.ankillm.domain.Row;
import app.ankillm.domain.ValidatedCard;
import app.ankillm.generate.BatchResult;
import app.ankillm.generate.BatchRunner;
import app.ankillm.generate.CardValidationService;
import app.ankillm.generate.GenerationContext;
import app.ankillm.generate.ImportResult;
import app.ankillm.generate.QualityCheckOutcome;
import app.ankillm.generate.QualityCheckService;
import app.ankillm.generate.RetryPolicy;
import app.ankillm.generate.ReviewPrompter;
import app.ankillm.generate.StoreAssetValidator;
import app.ankillm.generate.StoreImporter;
import app.ankillm.generate.TemplateRenderer;
import app.ankillm.io.CardFileExporter;
import app.ankillm.io.DataFileReader;
import app.ankillm.io.PromptFileParser;
import app.ankillm.llm.CompletionClient;
import app.ankillm.llm.LlmCostCalculator;
import app.ankillm.provider.openai.OpenAiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class GenerateCommand implements CliCommand {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final int DEFAULT_CONCURRENCY = 5;
    private static final int DEFAULT_MAX_ATTEMPTS = 4;
    private static final double DEFAULT_TEMPERATURE = 1.0;
    private static final long DEFAULT_BACKOFF_MS = 1_000L;
    private static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;

    private final PromptFileParser promptFileParser;
    private final DataFileReader dataFileReader;
    private final TemplateRenderer templateRenderer;
    private final StoreAssetValidator storeAssetValidator;
    private final BatchRunner batchRunner;
    private final CardValidationService cardValidationService;
    private final QualityCheckService qualityCheckService;
    private final CardFileExporter cardFileExporter;
    private final StoreImporter storeImporter;
    private final CompletionClient completionClient;
    private final LlmCostCalculator costCalculator;
    private final UserConfigStore userConfigStore;
    private final GenerationProps props;
    private final CardPresenter presenter;
    private final CardSelector selector;
    private final ReviewPrompter reviewPrompter;
    private final ConsoleIO console;

    public GenerateCommand(PromptFileParser promptFileParser,
                           DataFileReader dataFileReader,
                           TemplateRenderer templateRenderer,
                           StoreAssetValidator storeAssetValidator,
                           BatchRunner batchRunner,
                           CardValidationService cardValidationService,
                           QualityCheckService qualityCheckService,
                           CardFileExporter cardFileExporter,
                           StoreImporter storeImporter,
                           CompletionClient completionClient,
                           LlmCostCalculator costCalculator,
                           UserConfigStore userConfigStore,
                           GenerationProps props,
                           CardPresenter presenter,
                           CardSelector selector,
                           ReviewPrompter reviewPrompter,
                           ConsoleIO console) {
        this.promptFileParser = promptFileParser;
        this.dataFileReader = dataFileReader;
        this.templateRenderer = templateRenderer;
        this.storeAssetValidator = storeAssetValidator;
        this.batchRunner = batchRunner;
        this.cardValidationService = cardValidationService;
        this.qualityCheckService = qualityCheckService;
        this.cardFileExporter = cardFileExporter;
        this.storeImporter = storeImporter;
        this.completionClient = completionClient;
        this.costCalculator = costCalculator;
        this.userConfigStore = userConfigStore;
        this.props = props;
        this.presenter = presenter;
        this.selector = selector;
        this.reviewPrompter = reviewPrompter;
        this.console = console;
    }

    @Override
    public String name() {
        return "generate";
    }

    @Override
    public String description() {
        return "Generate cards for every row of a data file and add them to Anki or a file";
    }

    @Override
    public String usage() {
        return """
                Usage: anki-llm generate --prompt=<file> --input=<rows.csv|rows.yaml> [options]

                Options:
                  --output=<file>       Export cards to a .csv/.yaml file instead of adding them to Anki
                  --model=<name>        Model to use (default: configured model or gpt-4o-mini)
                  --concurrency=<n>     Concurrent requests
                  --retries=<n>         Retries per row after the first attempt
                  --temperature=<t>     Sampling temperature (0-2)
                  --max-tokens=<n>      Maximum tokens per response
                  --timeout=<seconds>   Overall time limit for the generation phase
                  --many-cards          Accept a JSON array of cards per row
                  --dry-run             Show the validated cards and stop
                  --yes                 Keep every generated card without asking""";
    }

    @Override
    public int run(CommandArguments arguments) {
        Path promptPath = Path.of(arguments.requiredOption("prompt"));
        Path inputPath = Path.of(arguments.requiredOption("input"));
        Optional<Path> output = arguments.option("output").map(Path::of);
        boolean dryRun = arguments.flag("dry-run");
        boolean assumeYes = arguments.flag("yes");
        GenerationContext context = resolveContext(arguments);

        PromptTemplate template = promptFileParser.parse(promptPath);
        console.println("Loaded prompt for deck: " + template.deck() + " (note type: " + template.noteType() + ")");

        List<Row> rows = dataFileReader.readRows(inputPath);
        if (rows.isEmpty()) {
            console.println("No rows found in " + inputPath);
            return 0;
        }
        List<String> unresolved = templateRenderer.unresolvedPlaceholders(template.body(), DataFileReader.columns(rows));
        if (!unresolved.isEmpty()) {
            console.error("Error: the prompt uses placeholders that are not columns of " + inputPath + ": "
                    + unresolved.stream().map(name -> "{" + name + "}").collect(Collectors.joining(", "))
                    + ". Available columns: " + String.join(", ", DataFileReader.columns(rows)));
            return 1;
        }

        if (!completionClient.hasApiKey(context.model())) {
            console.error("Error: no API key for model " + context.model() + ". Set "
                    + OpenAiClient.apiKeyVariable(context.model()) + ".");
            return 1;
        }
        QualityCheckConfig qualityCheck = template.qualityCheck();
        if (qualityCheck != null && qualityCheck.model() != null && !qualityCheck.model().isBlank()
                && !completionClient.hasApiKey(qualityCheck.model())) {
            console.error("Error: no API key for quality check model " + qualityCheck.model() + ". Set "
                    + OpenAiClient.apiKeyVariable(qualityCheck.model()) + ".");
            return 1;
        }
        if (!costCalculator.isKnown(context.model())) {
            log.warn("No pricing for model={}, cost is reported as zero", context.model());
            console.println("Note: no pricing known for " + context.model() + ", cost is reported as $0.0000");
        }

        List<String> noteTypeFields = storeAssetValidator.validate(template);
        console.println("Note type fields: " + String.join(", ", noteTypeFields));

        console.println("Generating cards for " + rows.size() + " row(s) with " + context.model()
                + " (concurrency " + context.concurrency() + ")...");
        BatchResult batch = batchRunner.run(rows, template, context);
        presenter.printBatchSummary(batch);
        if (batch.candidates().isEmpty()) {
            console.error("Error: no cards were generated.");
            return 1;
        }
        int exitCode = batch.hasFailures() ? 1 : 0;

        List<ValidatedCard> validated = cardValidationService.validate(batch.candidates(), template, noteTypeFields.get(0));
        long duplicates = validated.stream().filter(ValidatedCard::duplicate).count();
        if (duplicates > 0) {
            console.println("Found " + duplicates + " duplicate(s) (already in Anki)");
        }
        if (dryRun) {
            presenter.displayCards(validated);
            return exitCode;
        }

        List<ValidatedCard> selected = assumeYes ? validated : selector.select(validated);
        if (selected.isEmpty()) {
            console.println("No cards selected.");
            return exitCode;
        }

        BigDecimal totalCost = batch.cost();
        List<ValidatedCard> finalCards = selected;
        if (template.hasQualityCheck()) {
            ReviewPrompter prompter = assumeYes ? (flagged, position, total) -> false : reviewPrompter;
            QualityCheckOutcome outcome = qualityCheckService.run(selected, template.qualityCheck(), context, prompter);
            presenter.printQualityCheck(outcome);
            totalCost = totalCost.add(outcome.cost());
            finalCards = outcome.finalCards();
            if (finalCards.isEmpty()) {
                console.println("No cards left after the quality check.");
                printTotalCost(totalCost);
                return exitCode;
            }
        }

        if (output.isPresent()) {
            CardFileExporter.ExportResult exported = cardFileExporter.export(finalCards, output.get());
            console.println(exported.appended()
                    ? "Appended " + exported.addedCount() + " card(s) to " + exported.output()
                            + " (" + exported.existingCount() + " already there)"
                    : "Exported " + exported.addedCount() + " card(s) to " + exported.output());
        } else {
            ImportResult imported = storeImporter.importCards(finalCards, template);
            if (imported.failures() > 0) {
                console.println("Added " + imported.successes() + " card(s), " + imported.failures() + " failed.");
                console.println("Some cards may have been duplicates or had invalid field values.");
                exitCode = 1;
            } else {
                console.println("Successfully added " + imported.successes() + " new note(s) to \"" + template.deck() + "\"");
            }
        }
        printTotalCost(totalCost);
        return exitCode;
    }

    GenerationContext resolveContext(CommandArguments arguments) {
        String model = arguments.option("model")
                .or(() -> userConfigStore.get(UserConfigStore.MODEL_KEY))
                .orElseGet(() -> props.model() == null || props.model().isBlank() ? DEFAULT_MODEL : props.model());

        int concurrency = arguments.intOption("concurrency")
                .orElse(props.concurrency() == null ? DEFAULT_CONCURRENCY : props.concurrency());
        if (concurrency < 1) {
            throw new UsageException("--concurrency must be at least 1");
        }

        int maxAttempts = arguments.intOption("retries")
                .map(retries -> {
                    if (retries < 0) {
                        throw new UsageException("--retries must not be negative");
                    }
                    return retries + 1;
                })
                .orElse(props.maxAttempts() == null ? DEFAULT_MAX_ATTEMPTS : props.maxAttempts());

        double temperature = arguments.doubleOption("temperature")
                .orElse(props.temperature() == null ? DEFAULT_TEMPERATURE : props.temperature());
        if (temperature < 0 || temperature > 2) {
            throw new UsageException("--temperature must be between 0 and 2");
        }

        Integer maxTokens = arguments.intOption("max-tokens").orElse(props.maxTokens());
        if (maxTokens != null && maxTokens <= 0) {
            maxTokens = null;
        }

        long timeoutSeconds = arguments.longOption("timeout")
                .orElse(props.timeoutSeconds() == null ? 0L : props.timeoutSeconds());
        Duration timeout = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;

        RetryPolicy retryPolicy = new RetryPolicy(
                maxAttempts,
                Duration.ofMillis(props.backoffMs() == null ? DEFAULT_BACKOFF_MS : props.backoffMs()),
                Duration.ofMillis(props.maxBackoffMs() == null ? DEFAULT_MAX_BACKOFF_MS : props.maxBackoffMs())
        );
        return new GenerationContext(model, temperature, maxTokens, concurrency, retryPolicy, timeout,
                arguments.flag("many-cards"), arguments.runId());
    }

    private void printTotalCost(BigDecimal cost) {
        console.println("Total cost: " + LlmCostCalculator.format(cost));
    }
}
