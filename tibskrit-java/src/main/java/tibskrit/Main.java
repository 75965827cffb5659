package tibskrit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.IntStream;

/**
 * CLI entry point for the transliterator.
 * Usage: java -cp classes tibskrit.Main --input <file> [--output <file>] [--form nfd|nfc] [--json]
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    public static void main(String[] args) {
        String inputPath = null;
        String outputPath = null;
        NormalForm form = NormalForm.NFD;
        boolean json = false;
        Integer limit = null;
        int threads = 0; // 0 = use all available

        // Parse arguments
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--input":
                    case "-i":
                        inputPath = args[++i];
                        break;
                    case "--output":
                    case "-o":
                        outputPath = args[++i];
                        break;
                    case "--form":
                        form = NormalForm.of(args[++i]);
                        break;
                    case "--json":
                    case "-j":
                        json = true;
                        break;
                    case "--limit":
                    case "-l":
                        limit = Integer.parseInt(args[++i]);
                        break;
                    case "--threads":
                    case "-t":
                        threads = Integer.parseInt(args[++i]);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                }
            }
        } catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
            System.err.println("Error: " + (e.getMessage() != null ? e.getMessage() : "missing option value"));
            inputPath = null;
        }

        if (inputPath == null) {
            System.err.println("Usage: java tibskrit.Main --input <file> [--output <file>] [options]");
            System.err.println("Options:");
            System.err.println("  --output, -o <path> Output file (optional, defaults to stdout)");
            System.err.println("  --form <nfd|nfc>    Unicode form used before conversion (default nfd)");
            System.err.println("  --json, -j          Write one JSON object per line");
            System.err.println("  --limit, -l <n>     Limit number of lines to process");
            System.err.println("  --threads, -t <n>   Number of threads (0 = auto)");
            System.exit(1);
        }

        try {
            run(inputPath, outputPath, form, json, limit, threads);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            log.debug("Conversion failed", e);
            System.exit(1);
        }
    }

    private static void run(String inputPath, String outputPath, NormalForm form, boolean json,
                            Integer limit, int threads) throws IOException {
        log.info("Reading source: {}", inputPath);

        List<String> lines;
        try (BufferedReader reader = Files.newBufferedReader(Path.of(inputPath), StandardCharsets.UTF_8)) {
            if (limit != null) {
                lines = reader.lines().limit(limit).toList();
            } else {
                lines = reader.lines().toList();
            }
        }

        int numThreads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
        log.info("Processing {} lines with {} threads, form {}", lines.size(), numThreads, form);

        long startProcess = System.currentTimeMillis();
        String[] results = convertLines(lines, new TibskritTransliterator(), form, json, numThreads);
        double duration = (System.currentTimeMillis() - startProcess) / 1000.0;

        OutputStream target = outputPath != null ? new FileOutputStream(outputPath) : System.out;
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(target, StandardCharsets.UTF_8), 65536);
        try {
            for (String line : results) {
                writer.write(line);
                writer.newLine();
            }
        } finally {
            if (outputPath != null) {
                writer.close();
            } else {
                writer.flush();
            }
        }

        if (outputPath != null) {
            log.info("Done. Saved to {}", outputPath);
        }
        log.info("Time taken: {}s", String.format("%.2f", duration));
    }

    /**
     * Convert every line, in parallel, keeping the input order.
     * A line break closes every stack and aksara, so lines are independent.
     */
    static String[] convertLines(List<String> lines, TibskritTransliterator transliterator,
                                 NormalForm form, boolean json, int numThreads) throws IOException {
        int numLines = lines.size();
        String[] results = new String[numLines];

        ForkJoinPool pool = new ForkJoinPool(numThreads);
        try {
            pool.submit(() ->
                IntStream.range(0, numLines)
                    .parallel()
                    .forEach(i -> {
                        String line = lines.get(i);
                        Conversion conversion = transliterator.convert(line, form);
                        results[i] = json ? toJson(i, line, conversion) : conversion.getOutput();
                    })
            ).get();
        } catch (Exception e) {
            throw new IOException("Parallel processing failed", e);
        } finally {
            pool.shutdown();
        }
        return results;
    }

    static String toJson(int id, String input, Conversion conversion) {
        return GSON.toJson(new JsonLine(id, input, conversion.getOutput(), conversion.isValid()));
    }

    // {"id":N,"input":"...","output":"...","valid":true}
    static class JsonLine {
        int id;
        String input;
        String output;
        boolean valid;

        JsonLine(int id, String input, String output, boolean valid) {
            this.id = id;
            this.input = input;
            this.output = output;
            this.valid = valid;
        }
    }
}
