package com.ctdl.scout.cli;

import com.ctdl.scout.service.DownloadDispatcher;
import com.ctdl.scout.service.FileSearchService;
import com.ctdl.scout.service.LoggerService;
import com.ctdl.scout.service.catalog.ExtensionCatalog;
import com.ctdl.scout.service.catalog.ThreatClassifier;
import com.ctdl.scout.service.download.DownloadJob;
import com.ctdl.scout.service.search.SearchQuery;
import com.ctdl.scout.service.search.SearchRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry: search for files on a topic and download the available ones.
 */
@Component
@RequiredArgsConstructor
@Command(
        name = "scout",
        description = "Content Downloader",
        footer = "Now download files on any topic in bulk!",
        mixinStandardHelpOptions = true,
        version = "scout 1.0.0"
)
public class ScoutCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final FileSearchService fileSearchService;
    private final DownloadDispatcher downloadDispatcher;
    private final ThreatClassifier threatClassifier;
    private final ThreatPrompt threatPrompt;
    private final LoggerService logger;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Specify the query.")
    String query;

    @Option(names = {"-f", "--file_type"}, defaultValue = SearchQuery.DEFAULT_FILE_TYPE,
            description = "Specify the extension of files to download (default: ${DEFAULT-VALUE}).")
    String fileType;

    @Option(names = {"-l", "--limit"}, defaultValue = "10",
            description = "Limit the number of search results (in multiples of 10, default: ${DEFAULT-VALUE}).")
    int limit;

    @Option(names = {"-d", "--directory"},
            description = "Specify directory where files will be stored (default: the query with spaces as hyphens).")
    String directory;

    @Option(names = {"-p", "--parallel"}, description = "For parallel downloading.")
    boolean parallel;

    @Option(names = {"-a", "--available"}, description = "Get list of all available filetypes.")
    boolean available;

    @Option(names = {"-t", "--threats"}, description = "Get list of all common virus carrier filetypes.")
    boolean threats;

    @Option(names = {"-minfs", "--min-file-size"}, defaultValue = "0",
            description = "Specify minimum file size to download in Kilobytes (KB).")
    long minFileSize;

    @Option(names = {"-maxfs", "--max-file-size"}, defaultValue = "-1",
            description = "Specify maximum file size to download in Kilobytes (KB), -1 for no limit.")
    long maxFileSize;

    @Option(names = {"-nr", "--no-redirects"}, description = "Prevent download redirects.")
    boolean noRedirects;

    @Option(names = {"-y", "--yes"}, description = "Download high risk file types without asking.")
    boolean assumeYes;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        if (available) {
            FileTypeTable.render(ExtensionCatalog.FILE_TYPES).forEach(out::println);
            out.flush();
            return EXIT_OK;
        }

        if (threats) {
            FileTypeTable.render(ExtensionCatalog.THREATS).forEach(out::println);
            out.flush();
            return EXIT_OK;
        }

        validateOptions();

        if (threatClassifier.isHighThreat(fileType) && !assumeYes) {
            if (threatPrompt.confirm(out) == ThreatPrompt.State.ABORTED) {
                logger.debug("CLI", "High threat file type declined: " + fileType);
                return EXIT_OK;
            }
        }

        if (query == null || query.isBlank()) {
            out.println();
            out.println("Missing required query argument.");
            out.flush();
            return EXIT_FAILURE;
        }

        String target = directory == null || directory.isBlank() ? DownloadJob.defaultDirectory(query) : directory;
        out.printf("Downloading %d %s files on topic %s and saving to directory: %s%n", limit, fileType, query, target);
        out.flush();

        try {
            List<String> links = fileSearchService.search(new SearchQuery(query, fileType, limit));
            DownloadJob job = new DownloadJob(new LinkedHashSet<>(links), Path.of(target), minFileSize, maxFileSize, noRedirects);
            if (parallel) {
                downloadDispatcher.downloadParallel(job);
            } else {
                downloadDispatcher.downloadSeries(job);
            }
            return EXIT_OK;
        } catch (SearchRequestException | UncheckedIOException e) {
            logger.error("CLI", "❌ Run aborted: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    private void validateOptions() {
        if (fileType == null || fileType.isBlank()) {
            throw new ParameterException(spec.commandLine(), "--file_type must not be blank");
        }
        if (limit < 0) {
            throw new ParameterException(spec.commandLine(), "--limit must not be negative but was " + limit);
        }
        if (minFileSize < 0) {
            throw new ParameterException(spec.commandLine(), "--min-file-size must not be negative but was " + minFileSize);
        }
        if (maxFileSize != DownloadJob.UNBOUNDED && maxFileSize < minFileSize) {
            throw new ParameterException(spec.commandLine(),
                    "--max-file-size " + maxFileSize + " is below --min-file-size " + minFileSize);
        }
    }
}
