package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * Both output streams are drained on separate threads so a chatty tool cannot block on a full pipe.
 * Output is decoded with the configured charset, by default the native encoding that console
 * tools such as sc.exe write in.
 */
@Slf4j
@Component
public class ProcessCommandRunner implements CommandRunner {
    
    private static final int MAX_CAPTURED_BYTES = 64 * 1024;
    private static final long KILL_GRACE_SECONDS = 5;
    
    private final ExecutorService streamReaders;
    private final Charset outputCharset;
    
    @Autowired
    public ProcessCommandRunner(ServiceHostProperties properties) {
        this(resolveCharset(properties.getHostTool().getOutputCharset()));
    }
    
    public ProcessCommandRunner() {
        this(nativeCharset());
    }
    
    public ProcessCommandRunner(Charset outputCharset) {
        this.outputCharset = outputCharset;
        AtomicInteger counter = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "process-output-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
    
    @Override
    public ProcessOutcome run(List<String> command, Path workingDirectory, Duration timeout) {
        long started = System.nanoTime();
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("Failed to launch {}: {}", command.get(0), e.getMessage());
            return ProcessOutcome.launchFailed("Failed to launch " + command.get(0) + ": " + e.getMessage(),
                elapsedMs(started));
        }
        
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.error("{} exceeded {} ms, killing process tree", command.get(0), timeout.toMillis());
                kill(process);
                return new ProcessOutcome(-1, collect(stdout), collect(stderr), true, elapsedMs(started));
            }
            int exitCode = process.exitValue();
            log.debug("{} exited with {} after {} ms", command.get(0), exitCode, elapsedMs(started));
            return new ProcessOutcome(exitCode, collect(stdout), collect(stderr), false, elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            return ProcessOutcome.launchFailed("Interrupted while waiting for " + command.get(0), elapsedMs(started));
        }
    }
    
    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
    }
    
    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Process {} did not exit after forced kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
    
    Charset outputCharset() {
        return outputCharset;
    }
    
    static Charset resolveCharset(String configured) {
        if (configured == null || configured.isBlank()) {
            return nativeCharset();
        }
        try {
            return Charset.forName(configured.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new IllegalArgumentException("Unsupported output charset: " + configured, e);
        }
    }
    
    static Charset nativeCharset() {
        String nativeEncoding = System.getProperty("native.encoding");
        if (nativeEncoding != null) {
            try {
                return Charset.forName(nativeEncoding);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                log.warn("Native encoding {} is not supported, using {}", nativeEncoding, Charset.defaultCharset(), e);
            }
        }
        return Charset.defaultCharset();
    }
    
    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                byte[] captured = in.readNBytes(MAX_CAPTURED_BYTES);
                // discard the rest so the child never blocks on a full pipe
                in.transferTo(OutputStream.nullOutputStream());
                return new String(captured, outputCharset);
            } catch (IOException e) {
                return "<output unavailable: " + e.getMessage() + ">";
            }
        }, streamReaders);
    }
    
    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (ExecutionException | TimeoutException e) {
            return "<output unavailable: " + e.getClass().getSimpleName() + ">";
        }
    }
    
    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
