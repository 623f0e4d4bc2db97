package jobrelay.relay.process;

import jobrelay.relay.model.JobKind;
import jobrelay.relay.parser.LineAssembler;
import jobrelay.relay.parser.ProgressParser;
import jobrelay.relay.parser.StreamOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProcessLauncher} backed by {@link ProcessBuilder}.
 *
 * Each launched program gets three tasks on a daemon I/O pool:
 * - a read loop for stdout
 * - a read loop for stderr
 * - a waiter that reports the exit once both streams are drained
 *
 * Read loops feed raw chunks through a {@link LineAssembler} so lines split across
 * pipe reads are parsed whole.
 */
public class ProcessRunner implements ProcessLauncher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int READ_BUFFER_SIZE = 8192;

    private final ExecutorService ioExecutor;

    public ProcessRunner() {
        AtomicInteger counter = new AtomicInteger();
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "jobrelay-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public LaunchedProcess launch(JobKind kind, JobCommand command, ProcessListener listener) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command.command());
        pb.environment().putAll(command.environment());
        if (command.workingDirectory() != null) {
            pb.directory(command.workingDirectory().toFile());
        }

        Process process = pb.start();
        // nothing is written to the program
        process.getOutputStream().close();

        log.info("[{}] spawned pid {}: {}", kind, process.pid(), String.join(" ", command.command()));

        AtomicBoolean completionMarker = new AtomicBoolean(false);
        Future<?> stdout = ioExecutor.submit(
                () -> pump(kind, StreamOrigin.STDOUT, process.getInputStream(), listener, completionMarker));
        Future<?> stderr = ioExecutor.submit(
                () -> pump(kind, StreamOrigin.STDERR, process.getErrorStream(), listener, completionMarker));
        ioExecutor.execute(() -> awaitExit(kind, process, stdout, stderr, listener, completionMarker));

        return new NativeProcess(process);
    }

    private void pump(JobKind kind, StreamOrigin origin, InputStream in, ProcessListener listener,
            AtomicBoolean completionMarker) {
        LineAssembler assembler = new LineAssembler();
        byte[] buffer = new byte[READ_BUFFER_SIZE];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                for (String line : assembler.feed(buffer, 0, n)) {
                    handleLine(kind, origin, line, listener, completionMarker);
                }
            }
        } catch (IOException e) {
            // pipe closed under us, usually because the program was killed
            log.debug("[{}] {} closed: {}", kind, origin, e.getMessage());
        }
        assembler.finish().ifPresent(line -> handleLine(kind, origin, line, listener, completionMarker));
    }

    private void handleLine(JobKind kind, StreamOrigin origin, String line, ProcessListener listener,
            AtomicBoolean completionMarker) {
        if (origin == StreamOrigin.STDERR) {
            log.debug("[{}] stderr: {}", kind, line);
        } else {
            log.debug("[{}] {}", kind, line);
        }

        if (ProgressParser.isCompletionMarker(line)) {
            completionMarker.set(true);
            return;
        }

        ProgressParser.parseLine(kind, origin, line).ifPresent(event -> {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[{}] listener failed on {} event", kind, event.type().wireName(), e);
            }
        });
    }

    private void awaitExit(JobKind kind, Process process, Future<?> stdout, Future<?> stderr,
            ProcessListener listener, AtomicBoolean completionMarker) {
        int exitCode;
        try {
            stdout.get();
            stderr.get();
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted while waiting for pid {}, killing it", kind, process.pid());
            process.destroyForcibly();
            exitCode = -1;
        } catch (ExecutionException e) {
            log.error("[{}] output reader failed", kind, e.getCause());
            exitCode = waitQuietly(process);
        }

        log.info("[{}] pid {} exited with code {}", kind, process.pid(), exitCode);
        try {
            listener.onExit(new ProcessExit(exitCode, completionMarker.get()));
        } catch (RuntimeException e) {
            log.error("[{}] listener failed on exit", kind, e);
        }
    }

    private static int waitQuietly(Process process) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return -1;
        }
    }

    @Override
    public void close() {
        ioExecutor.shutdownNow();
    }

    /** Handle over a real OS process */
    private static final class NativeProcess implements LaunchedProcess {
        private final Process process;

        NativeProcess(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void kill() {
            process.destroyForcibly();
        }
    }
}
