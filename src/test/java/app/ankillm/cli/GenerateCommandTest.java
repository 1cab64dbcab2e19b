package app.ankillm.cli;

import app.ankillm.config.GenerationProps;
import app.ankillm.config.UserConfigStore;
import app.ankillm.domain.CardCandidate;
import app.ankillm.domain.ProcessedRow;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.Row;
import app.ankillm.domain.ValidatedCard;
import app.ankillm.generate.BatchResult;
import app.ankillm.generate.BatchRunner;
import app.ankillm.generate.CardValidationService;
import app.ankillm.generate.GenerationContext;
import app.ankillm.generate.ImportResult;
import app.ankillm.generate.QualityCheckService;
import app.ankillm.generate.ReviewPrompter;
import app.ankillm.generate.StoreAssetValidator;
import app.ankillm.generate.StoreImporter;
import app.ankillm.generate.TemplateRenderer;
import app.ankillm.io.CardFileExporter;
import app.ankillm.io.DataFileReader;
import app.ankillm.io.PromptFileParser;
import app.ankillm.llm.CompletionClient;
import app.ankillm.llm.LlmCostCalculator;
import app.ankillm.llm.TokenStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class GenerateCommandTest {

    private static final GenerationProps PROPS = new GenerationProps(null, 3, 2, 0L, 0L, null, null, null);

    @TempDir
    Path tempDir;

    private final StoreAssetValidator storeAssetValidator = mock(StoreAssetValidator.class);
    private final BatchRunner batchRunner = mock(BatchRunner.class);
    private final CardValidationService cardValidationService = mock(CardValidationService.class);
    private final QualityCheckService qualityCheckService = mock(QualityCheckService.class);
    private final CardFileExporter cardFileExporter = mock(CardFileExporter.class);
    private final StoreImporter storeImporter = mock(StoreImporter.class);
    private final CompletionClient completionClient = mock(CompletionClient.class);
    private final UserConfigStore userConfigStore = mock(UserConfigStore.class);
    private final CardSelector selector = mock(CardSelector.class);
    private final ReviewPrompter reviewPrompter = mock(ReviewPrompter.class);
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private GenerateCommand command;
    private Path promptFile;
    private Path inputFile;

    @BeforeEach
    void setUp() throws IOException {
        ConsoleIO console = new ConsoleIO(new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        command = new GenerateCommand(new PromptFileParser(), new DataFileReader(), new TemplateRenderer(),
                storeAssetValidator, batchRunner, cardValidationService, qualityCheckService, cardFileExporter,
                storeImporter, completionClient, new LlmCostCalculator(), userConfigStore, PROPS,
                new CardPresenter(console), selector, reviewPrompter, console);

        promptFile = tempDir.resolve("prompt.md");
        Files.writeString(promptFile, "---\ndeck: Japanese\nnoteType: Basic\nfieldMap:\n  jp: Front\n  en: Back\n---\n"
                + "Card for {term}", StandardCharsets.UTF_8);
        inputFile = tempDir.resolve("words.csv");
        Files.writeString(inputFile, "term\n猫\n犬\n", StandardCharsets.UTF_8);

        when(userConfigStore.get(UserConfigStore.MODEL_KEY)).thenReturn(Optional.empty());
        when(completionClient.hasApiKey(anyString())).thenReturn(true);
        when(storeAssetValidator.validate(any(PromptTemplate.class))).thenReturn(List.of("Front", "Back"));
    }

    @Test
    void resolvesSettingsFromOptionsConfigAndDefaults() {
        when(userConfigStore.get(UserConfigStore.MODEL_KEY)).thenReturn(Optional.of("gpt-4.1"));

        GenerationContext context = command.resolveContext(arguments("--retries=0", "--max-tokens=0", "--timeout=30"));

        assertEquals("gpt-4.1", context.model());
        assertEquals(3, context.concurrency());
        assertEquals(1, context.retryPolicy().maxAttempts());
        assertEquals(1.0, context.temperature());
        assertThat(context.maxTokens()).isNull();
        assertEquals(Duration.ofSeconds(30), context.timeout());
        assertThat(context.hasDeadline()).isTrue();
        assertThat(context.manyCards()).isFalse();
    }

    @Test
    void modelOptionWinsAndDefaultsApply() {
        GenerationContext explicit = command.resolveContext(arguments("--model=gpt-4o", "--many-cards"));
        GenerationContext fallback = command.resolveContext(arguments());

        assertEquals("gpt-4o", explicit.model());
        assertThat(explicit.manyCards()).isTrue();
        assertEquals(GenerateCommand.DEFAULT_MODEL, fallback.model());
        assertEquals(2, fallback.retryPolicy().maxAttempts());
        assertThat(fallback.timeout()).isNull();
        assertThat(fallback.hasDeadline()).isFalse();
    }

    @Test
    void rejectsOutOfRangeSettings() {
        assertThatThrownBy(() -> command.resolveContext(arguments("--temperature=2.5")))
                .isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> command.resolveContext(arguments("--concurrency=0")))
                .isInstanceOf(UsageException.class);
        assertThatThrownBy(() -> command.resolveContext(arguments("--retries=-1")))
                .isInstanceOf(UsageException.class);
    }

    @Test
    void unknownPlaceholderStopsBeforeAnyCall() throws IOException {
        Files.writeString(promptFile, "---\ndeck: D\nnoteType: Basic\nfieldMap:\n  f: Front\n---\n{word} {term}",
                StandardCharsets.UTF_8);

        int exitCode = command.run(arguments("--prompt=" + promptFile, "--input=" + inputFile));

        assertEquals(1, exitCode);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("{word}").contains("Available columns: term");
        verifyNoInteractions(batchRunner, storeAssetValidator);
    }

    @Test
    void missingApiKeyStopsBeforeAnyCall() {
        when(completionClient.hasApiKey(anyString())).thenReturn(false);

        int exitCode = command.run(arguments("--prompt=" + promptFile, "--input=" + inputFile));

        assertEquals(1, exitCode);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("OPENAI_API_KEY");
        verifyNoInteractions(batchRunner);
    }

    @Test
    void missingKeyForQualityCheckModelStopsBeforeAnyCall() throws IOException {
        Files.writeString(promptFile, "---\ndeck: Japanese\nnoteType: Basic\nfieldMap:\n  jp: Front\n"
                + "qualityCheck:\n  field: jp\n  prompt: \"Check {text}\"\n  model: gemini-2.5-flash\n---\n"
                + "Card for {term}", StandardCharsets.UTF_8);
        when(completionClient.hasApiKey("gemini-2.5-flash")).thenReturn(false);

        int exitCode = command.run(arguments("--prompt=" + promptFile, "--input=" + inputFile, "--model=gpt-4o"));

        assertEquals(1, exitCode);
        assertThat(err.toString(StandardCharsets.UTF_8))
                .contains("quality check model gemini-2.5-flash")
                .contains("GEMINI_API_KEY");
        verifyNoInteractions(batchRunner, storeAssetValidator);
    }

    @Test
    void assumeYesExportsEveryCardAndReportsFailedRows() {
        ValidatedCard card = card(0, "猫");
        when(batchRunner.run(anyList(), any(PromptTemplate.class), any(GenerationContext.class))).thenReturn(new BatchResult(
                List.of(card.candidate()),
                List.of(new ProcessedRow(new Row(1, Map.of("term", "犬")), "Invalid JSON response")),
                new TokenStats(100, 10), BigDecimal.ZERO, 2));
        when(cardValidationService.validate(anyList(), any(PromptTemplate.class), eq("Front"))).thenReturn(List.of(card));
        Path output = tempDir.resolve("out.csv");
        when(cardFileExporter.export(List.of(card), output))
                .thenReturn(new CardFileExporter.ExportResult(output, 0, 1, false));

        int exitCode = command.run(arguments("--prompt=" + promptFile, "--input=" + inputFile,
                "--output=" + output, "--yes"));

        assertEquals(1, exitCode);
        verify(cardFileExporter).export(List.of(card), output);
        verifyNoInteractions(selector, storeImporter, qualityCheckService);
        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("1 row(s) succeeded, 1 failed")
                .contains("row #2: Invalid JSON response")
                .contains("Tokens: 100 in, 10 out (110 total)")
                .contains("Exported 1 card(s)");
    }

    @Test
    void dryRunStopsAfterDisplayingCards() {
        ValidatedCard card = card(0, "猫");
        when(batchRunner.run(anyList(), any(PromptTemplate.class), any(GenerationContext.class))).thenReturn(
                new BatchResult(List.of(card.candidate()), List.of(), TokenStats.ZERO, BigDecimal.ZERO, 2));
        when(cardValidationService.validate(anyList(), any(PromptTemplate.class), anyString())).thenReturn(List.of(card));

        int exitCode = command.run(arguments("--prompt=" + promptFile, "--input=" + inputFile, "--dry-run"));

        assertEquals(0, exitCode);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("This is a dry run.");
        verifyNoInteractions(selector, storeImporter, cardFileExporter);
    }

    @Test
    void rejectedImportsSetExitCode() {
        ValidatedCard card = card(0, "猫");
        when(batchRunner.run(anyList(), any(PromptTemplate.class), any(GenerationContext.class))).thenReturn(
                new BatchResult(List.of(card.candidate()), List.of(), TokenStats.ZERO, BigDecimal.ZERO, 2));
        when(cardValidationService.validate(anyList(), any(PromptTemplate.class), anyString())).thenReturn(List.of(card));
        when(selector.select(List.of(card))).thenReturn(List.of(card));
        when(storeImporter.importCards(eq(List.of(card)), any(PromptTemplate.class)))
                .thenReturn(new ImportResult(0, List.of("猫")));

        int exitCode = command.run(arguments("--prompt=" + promptFile, "--input=" + inputFile));

        assertEquals(1, exitCode);
        verify(cardFileExporter, never()).export(anyList(), any(Path.class));
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Added 0 card(s), 1 failed.");
    }

    private static CommandArguments arguments(String... options) {
        String[] args = new String[options.length + 1];
        args[0] = "generate";
        System.arraycopy(options, 0, args, 1, options.length);
        return new CommandArguments(new DefaultApplicationArguments(args), "test-run");
    }

    private static ValidatedCard card(int rowIndex, String jp) {
        CardCandidate candidate = new CardCandidate(rowIndex, Map.of("jp", jp, "en", "cat"), "{}");
        return new ValidatedCard(candidate, false, Map.of("Front", jp, "Back", "cat"));
    }
}
