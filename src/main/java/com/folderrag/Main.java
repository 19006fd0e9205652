package com.folderrag;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.folderrag.error.DocumentsNotFoundException;
import com.folderrag.error.InvalidConfigurationException;
import com.folderrag.error.OperationCancelledException;
import com.folderrag.error.RagException;
import com.folderrag.inference.RagAnswer;
import com.folderrag.ingest.IndexingReport;
import com.folderrag.ingest.SearchResult;
import com.folderrag.runtime.AppConfig;
import com.folderrag.runtime.CancellationToken;
import com.folderrag.runtime.RagServices;
import com.folderrag.runtime.SessionConfig;
import com.folderrag.transport.OkHttpJsonTransport;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "folder-rag",
        mixinStandardHelpOptions = true,
        version = "folder-rag 0.1.0",
        description = "Index a folder of text documents and answer questions grounded in them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "folder-rag.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "chat")
    Mode mode;

    @Option(names = "--base-url", description = "Model server base URL (default from config, then http://localhost:11434)")
    String baseUrl;

    @Option(names = "--embedding-model", description = "Embedding model name")
    String embeddingModel;

    @Option(names = "--generation-model", description = "Generation model name")
    String generationModel;

    @Option(names = { "-f", "--folder" }, description = "Documents folder to index")
    Path folder;

    @Option(names = { "-q", "--query" }, description = "Question used in ask mode")
    String query;

    @Option(names = "--top-k", description = "Chunks retrieved per question")
    Integer topK;

    @Option(names = "--chunk-size", description = "Words per chunk")
    Integer chunkSize;

    @Option(names = "--overlap", description = "Words shared by consecutive chunks")
    Integer overlap;

    @Option(names = "--offline-embeddings", description = "Use a local hashed embedding instead of the model server (dry runs)", defaultValue = "false")
    boolean offlineEmbeddings;

    InputStream in = System.in;
    PrintStream out = System.out;
    Map<String, String> environment = System.getenv();

    enum Mode {
        ping,
        index,
        ask,
        chat
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        SessionConfig session;
        try {
            config = loadConfig(configPath);
            session = applyOverrides(SessionConfig.fromConfig(config, environment));
        } catch (IOException | InvalidConfigurationException e) {
            log.error("Invalid configuration {}: {}", configPath, e.getMessage());
            return 2;
        }
        log.info("Starting folder-rag in {} mode", mode);
        log.info("Session baseUrl={} embeddingModel={} generationModel={} folder={} topK={} chunkSize={} overlap={}",
                session.baseUrl(),
                offlineEmbeddings ? "offline-hashing" : session.embeddingModel(),
                session.generationModel(),
                session.documentsFolder(),
                session.topK(),
                session.chunkSizeWords(),
                session.overlapWords());

        OkHttpClient httpClient = OkHttpJsonTransport.httpClient(config.getService());
        RagServices services = RagServices.create(config, httpClient, offlineEmbeddings);
        CancellationToken cancellation = new CancellationToken();
        Thread cancelOnShutdown = new Thread(cancellation::cancel, "folder-rag-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnShutdown);
        try {
            return run(services, session, cancellation);
        } catch (InvalidConfigurationException | DocumentsNotFoundException e) {
            log.error("{}", e.getMessage());
            return 2;
        } catch (OperationCancelledException e) {
            log.warn("Cancelled: {}", e.getMessage());
            return 130;
        } catch (RagException | UncheckedIOException e) {
            log.error("Operation failed: {}", e.getMessage(), e);
            return 1;
        } finally {
            removeShutdownHook(cancelOnShutdown);
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    private int run(RagServices services, SessionConfig session, CancellationToken cancellation) throws IOException {
        switch (mode) {
            case ping -> {
                boolean reachable = services.ping(session);
                out.println(reachable
                        ? "Connected to " + session.baseUrl()
                        : "Cannot reach " + session.baseUrl() + ". Is the model server running?");
                return reachable ? 0 : 1;
            }
            case index -> {
                IndexingReport report = indexFolder(services, session, cancellation);
                out.printf("Indexed %d chunks from %d files in '%s'.%n",
                        report.chunks(), report.indexedFiles(), session.documentsFolder());
                return 0;
            }
            case ask -> {
                if (query == null || query.isBlank()) {
                    log.error("--query is required in ask mode");
                    return 2;
                }
                indexFolder(services, session, cancellation);
                RagAnswer answer = services.ask(session, query, cancellation);
                out.println(answer.text());
                printSources(answer.sources());
                return 0;
            }
            case chat -> {
                runChat(services, session, cancellation);
                return 0;
            }
            default -> throw new IllegalStateException("Unhandled mode " + mode);
        }
    }

    private IndexingReport indexFolder(RagServices services, SessionConfig session, CancellationToken cancellation) {
        IndexingReport report = services.index(session, message -> log.info("{}", message), cancellation);
        log.info("Indexed documents: files={} discovered={} chunks={}",
                report.indexedFiles(), report.discoveredFiles(), report.chunks());
        return report;
    }

    private void runChat(RagServices services, SessionConfig session, CancellationToken cancellation) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        if (session.documentsFolder() != null) {
            indexFolder(services, session, cancellation);
        }
        List<SearchResult> lastSources = List.of();

        out.println("folder-rag chat ready. Type /help for commands.");
        while (!cancellation.isCancelled()) {
            out.print("you> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            if ("/exit".equals(input) || "/quit".equals(input)) {
                break;
            }
            if ("/help".equals(input)) {
                out.println("Commands: /help, /count, /clear, /reindex, /sources, /exit");
                continue;
            }
            if ("/count".equals(input)) {
                out.printf("Indexed chunks: %d%n", services.size());
                continue;
            }
            if ("/clear".equals(input)) {
                services.clear();
                lastSources = List.of();
                out.println("Index cleared.");
                continue;
            }
            if ("/reindex".equals(input)) {
                reindex(services, session, cancellation);
                continue;
            }
            if ("/sources".equals(input)) {
                printSources(lastSources);
                continue;
            }

            try {
                RagAnswer answer = services.ask(session, input, cancellation);
                lastSources = answer.sources();
                out.println("assistant> " + answer.text());
            } catch (OperationCancelledException e) {
                throw e;
            } catch (RagException e) {
                log.warn("Query failed: {}", e.getMessage());
                out.println("Query failed: " + e.getMessage());
            }
        }
    }

    private void reindex(RagServices services, SessionConfig session, CancellationToken cancellation) {
        if (session.documentsFolder() == null) {
            out.println("No documents folder configured; pass --folder.");
            return;
        }
        try {
            IndexingReport report = indexFolder(services, session, cancellation);
            out.printf("Indexed %d chunks.%n", report.chunks());
        } catch (OperationCancelledException e) {
            throw e;
        } catch (RagException | UncheckedIOException e) {
            log.warn("Indexing failed: {}", e.getMessage());
            out.println("Indexing error: " + e.getMessage());
        }
    }

    private void printSources(List<SearchResult> sources) {
        if (sources.isEmpty()) {
            out.println("No retrieval sources yet.");
            return;
        }
        for (int i = 0; i < sources.size(); i++) {
            SearchResult source = sources.get(i);
            out.printf("[%d] %s (score %.4f)%n", i + 1, source.chunk().source(), source.score());
        }
    }

    SessionConfig applyOverrides(SessionConfig base) {
        return new SessionConfig(
                baseUrl != null ? baseUrl : base.baseUrl(),
                embeddingModel != null ? embeddingModel : base.embeddingModel(),
                generationModel != null ? generationModel : base.generationModel(),
                folder != null ? folder : base.documentsFolder(),
                topK != null ? topK : base.topK(),
                chunkSize != null ? chunkSize : base.chunkSizeWords(),
                overlap != null ? overlap : base.overlapWords());
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; cancel hook left in place");
        }
    }
}
