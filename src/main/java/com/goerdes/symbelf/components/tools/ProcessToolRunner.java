package com.goerdes.symbelf.components.tools;

import com.goerdes.symbelf.exception.FileProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link ToolRunner} backed by {@link ProcessBuilder}. Standard error goes to a temporary file so
 * it never ends up in the parsed output.
 */
@Component
public class ProcessToolRunner implements ToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolRunner.class);

    @Override
    public String run(String executable, List<String> arguments) {
        List<String> cmd = new ArrayList<>();
        cmd.add(executable);
        cmd.addAll(arguments);

        log.debug("Running {}", cmd);

        try {
            Path stderr = Files.createTempFile("symbelf-", ".stderr");
            try {
                Process p = new ProcessBuilder(cmd).redirectError(stderr.toFile()).start();

                String out;
                try (InputStream in = p.getInputStream()) {
                    out = new String(in.readAllBytes(), UTF_8);
                }
                int exitCode = p.waitFor();
                if (exitCode != 0) {
                    log.warn("{} exited with code {}: {}", cmd, exitCode, new String(Files.readAllBytes(stderr), UTF_8).trim());
                }
                return out;
            } finally {
                Files.deleteIfExists(stderr);
            }
        } catch (IOException e) {
            throw new FileProcessingException("Unable to run " + executable + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FileProcessingException("Interrupted while running " + executable, e);
        }
    }
}
