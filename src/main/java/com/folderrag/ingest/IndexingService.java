package com.folderrag.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.folderrag.error.DocumentsNotFoundException;
import com.folderrag.error.OperationCancelledException;
import com.folderrag.runtime.CancellationToken;

/**
 * Rebuilds the vector index from a folder of text documents. The index is cleared only
 * after the folder is known to exist; a failed run leaves whatever was appended before
 * the failure and should be re-run rather than queried.
 */
public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final VectorIndex index;
    private final EmbeddingService embeddingService;
    private final DocumentReader reader;
    private final Chunker chunker;
    private final int embeddingConcurrency;

    public IndexingService(VectorIndex index, EmbeddingService embeddingService) {
        this(index, embeddingService, new PlainTextDocumentReader(), new Chunker(), 1);
    }

    public IndexingService(VectorIndex index,
            EmbeddingService embeddingService,
            DocumentReader reader,
            Chunker chunker,
            int embeddingConcurrency) {
        this.index = index;
        this.embeddingService = embeddingService;
        this.reader = reader;
        this.chunker = chunker;
        this.embeddingConcurrency = Math.max(1, embeddingConcurrency);
    }

    /**
     * Indexes every supported file under {@code folder} and returns the resulting chunk count.
     */
    public int indexDocuments(Path folder, String embeddingModel, ProgressSink progress) {
        return index(folder, embeddingModel, progress, CancellationToken.none()).chunks();
    }

    public IndexingReport index(Path folder, String embeddingModel, ProgressSink progress, CancellationToken cancellation) {
        if (!Files.isDirectory(folder)) {
            throw new DocumentsNotFoundException(folder);
        }
        List<Path> files = discover(folder);
        index.clear();
        log.info("index.start folder={} files={} model={} concurrency={}",
                folder, files.size(), embeddingModel, embeddingConcurrency);

        ExecutorService pool = embeddingConcurrency > 1 ? Executors.newFixedThreadPool(embeddingConcurrency) : null;
        int indexedFiles = 0;
        try {
            for (Path file : files) {
                cancellation.throwIfCancelled("indexing");
                String fileName = file.getFileName().toString();
                progress.report("Indexing " + fileName + "…");

                LoadedDocument document = read(file);
                List<String> pieces = chunker.chunk(document.content()).stream()
                        .filter(piece -> !piece.isBlank())
                        .toList();
                if (pool == null) {
                    embedSequentially(document.source(), pieces, embeddingModel, cancellation);
                } else {
                    embedConcurrently(document.source(), pieces, embeddingModel, cancellation, pool);
                }
                indexedFiles++;
                log.debug("index.file source={} chunks={}", document.source(), pieces.size());
            }
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }

        IndexingReport report = new IndexingReport(files.size(), indexedFiles, index.size());
        log.info("index.done folder={} files={} chunks={}", folder, report.indexedFiles(), report.chunks());
        return report;
    }

    List<Path> discover(Path folder) {
        try (Stream<Path> walk = Files.walk(folder)) {
            return walk.filter(Files::isRegularFile)
                    .filter(reader::supports)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list documents in " + folder, e);
        }
    }

    private LoadedDocument read(Path file) {
        try {
            return reader.read(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + file, e);
        }
    }

    private void embedSequentially(String source, List<String> pieces, String model, CancellationToken cancellation) {
        for (String piece : pieces) {
            cancellation.throwIfCancelled("indexing");
            float[] embedding = embeddingService.embed(piece, model, cancellation);
            index.append(new DocumentChunk(embedding, piece, source));
        }
    }

    private void embedConcurrently(String source,
            List<String> pieces,
            String model,
            CancellationToken cancellation,
            ExecutorService pool) {
        List<Future<float[]>> pending = new ArrayList<>(pieces.size());
        for (String piece : pieces) {
            pending.add(pool.submit(() -> embeddingService.embed(piece, model, cancellation)));
        }
        try {
            // Appending in submission order keeps chunks of one file in chunker order.
            for (int i = 0; i < pending.size(); i++) {
                float[] embedding = pending.get(i).get();
                index.append(new DocumentChunk(embedding, pieces.get(i), source));
            }
        } catch (ExecutionException e) {
            cancelAll(pending);
            throw unwrap(e);
        } catch (InterruptedException e) {
            cancelAll(pending);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("indexing interrupted");
        }
    }

    private static void cancelAll(List<Future<float[]>> pending) {
        for (Future<float[]> future : pending) {
            future.cancel(true);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Embedding task failed", cause);
    }
}
