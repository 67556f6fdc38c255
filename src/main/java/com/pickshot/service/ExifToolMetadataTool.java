package com.pickshot.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Talks to a single long-lived exiftool process running in {@code -stay_open}
 * mode.
 *
 * Each command is written as one argument per line followed by
 * {@code -execute<n>}; exiftool answers on stdout with a {@code {ready<n>}}
 * marker. {@code -echo4} makes it print the same marker on stderr once the
 * command has finished, so both streams can be read up to a known point.
 * Calls are serialized; timeouts are enforced by the caller, which closes the
 * tool to unblock a stuck read.
 */
public class ExifToolMetadataTool implements MetadataTool {

    private static final Logger log = LoggerFactory.getLogger(ExifToolMetadataTool.class);

    private static final List<String> READ_TAGS = List.of("Rating", "XMP:Rating", "RatingPercent");

    private static final Pattern WRITE_SUMMARY = Pattern.compile("(\\d+) image files? (?:updated|unchanged)");

    private static final TypeReference<List<Map<String, Object>>> JSON_ROWS = new TypeReference<>() {
    };

    private final Process process;
    private final BufferedWriter stdin;
    private final BufferedReader stdout;
    private final BufferedReader stderr;
    private final ObjectMapper mapper = new ObjectMapper();
    private int sequence = 0;

    private ExifToolMetadataTool(Process process) {
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stdout = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        this.stderr = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8));
    }

    /**
     * Launches exiftool.
     *
     * @throws MetadataToolException if the executable cannot be started
     */
    public static ExifToolMetadataTool start(String command) throws MetadataToolException {
        ProcessBuilder builder = new ProcessBuilder(command,
                "-stay_open", "True", "-@", "-",
                "-common_args", "-charset", "filename=utf8");
        try {
            Process process = builder.start();
            log.info("Started exiftool (pid {})", process.pid());
            return new ExifToolMetadataTool(process);
        } catch (IOException e) {
            throw new MetadataToolException("Failed to start exiftool '" + command + "': " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> readTags(Path file) throws MetadataToolException {
        List<String> args = new ArrayList<>();
        args.add("-json");
        args.add("-n");
        for (String tag : READ_TAGS) {
            args.add("-" + tag);
        }
        args.add(file.toAbsolutePath().toString());

        String output = execute(args);
        if (output.isBlank()) {
            return Map.of();
        }
        try {
            List<Map<String, Object>> rows = mapper.readValue(output, JSON_ROWS);
            return rows.isEmpty() ? Map.of() : rows.get(0);
        } catch (IOException e) {
            throw new MetadataToolException("Unreadable exiftool output for " + file.getFileName(), e);
        }
    }

    @Override
    public void writeTags(Path file, Map<String, Object> tags) throws MetadataToolException {
        List<String> args = new ArrayList<>();
        args.add("-overwrite_original");
        for (Map.Entry<String, Object> tag : tags.entrySet()) {
            args.add("-" + tag.getKey() + "=" + tag.getValue());
        }
        args.add(file.toAbsolutePath().toString());

        String output = execute(args);
        if (countWritten(output) < 1) {
            throw new MetadataToolException("exiftool did not update " + file.getFileName() + ": " + output.trim());
        }
    }

    /**
     * Files exiftool reports as updated or as already holding the values.
     */
    static int countWritten(String output) {
        int count = 0;
        Matcher matcher = WRITE_SUMMARY.matcher(output);
        while (matcher.find()) {
            count += Integer.parseInt(matcher.group(1));
        }
        return count;
    }

    private synchronized String execute(List<String> args) throws MetadataToolException {
        int id = ++sequence;
        String marker = "{ready" + id + "}";
        try {
            for (String arg : args) {
                stdin.write(arg);
                stdin.newLine();
            }
            stdin.write("-echo4");
            stdin.newLine();
            stdin.write(marker);
            stdin.newLine();
            stdin.write("-execute" + id);
            stdin.newLine();
            stdin.flush();

            String output = readUntil(stdout, marker);
            String errors = readUntil(stderr, marker);
            if (errors.contains("Error")) {
                throw new MetadataToolException(errors.trim());
            }
            return output;
        } catch (MetadataToolException e) {
            throw e;
        } catch (IOException e) {
            throw new MetadataTimeoutException("exiftool process terminated before task completed", e);
        }
    }

    private static String readUntil(BufferedReader reader, String marker) throws IOException {
        StringBuilder out = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.trim().equals(marker)) {
                return out.toString();
            }
            out.append(line).append('\n');
        }
        throw new MetadataTimeoutException("exiftool process terminated before task completed");
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void close() {
        try {
            stdin.write("-stay_open");
            stdin.newLine();
            stdin.write("False");
            stdin.newLine();
            stdin.flush();
        } catch (IOException e) {
            log.debug("exiftool stdin already closed: {}", e.getMessage());
        }
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }
}
