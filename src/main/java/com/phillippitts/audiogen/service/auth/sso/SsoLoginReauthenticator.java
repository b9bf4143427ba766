package com.phillippitts.audiogen.service.auth.sso;

import com.phillippitts.audiogen.service.auth.Reauthenticator;
import com.phillippitts.audiogen.util.ProcessTimeouts;
import com.phillippitts.audiogen.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Re-authenticates by running the cloud CLI's interactive SSO login:
 * <pre>
 * ${loginCommand} sso login --profile ${profile}
 * </pre>
 *
 * <p>Both output streams are forwarded line by line to the log while the process runs,
 * since the login prints the verification URL and code the user has to act on.
 * A run that exceeds the timeout is terminated.
 *
 * <p>Never throws. Start failures, timeouts and non-zero exits are logged; the caller's next
 * session attempt is the real success signal.
 */
public final class SsoLoginReauthenticator implements Reauthenticator {

    private static final Logger LOG = LogManager.getLogger(SsoLoginReauthenticator.class);

    private final ProcessFactory processFactory;
    private final String loginCommand;
    private final Duration timeout;

    public SsoLoginReauthenticator(String loginCommand, Duration timeout) {
        this(new DefaultProcessFactory(), loginCommand, timeout);
    }

    SsoLoginReauthenticator(ProcessFactory processFactory, String loginCommand, Duration timeout) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.loginCommand = Objects.requireNonNull(loginCommand, "loginCommand");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    List<String> buildCommand(String profile) {
        return List.of(loginCommand, "sso", "login", "--profile", profile);
    }

    @Override
    public void reauthenticate(String profile) {
        List<String> command = buildCommand(profile);
        long startTime = System.nanoTime();
        LOG.info("Starting SSO login for profile '{}'", profile);

        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            LOG.error("Failed to start SSO login ({}): {}", loginCommand, e.getMessage());
            return;
        }

        Thread outGobbler = startGobbler(process.getInputStream(), "sso-login-out");
        Thread errGobbler = startGobbler(process.getErrorStream(), "sso-login-err");
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                LOG.error("SSO login timed out after {}s for profile '{}'", timeout.toSeconds(), profile);
                return;
            }
            joinQuietly(outGobbler);
            joinQuietly(errGobbler);

            int exitCode = process.exitValue();
            long elapsedMs = TimeUtils.elapsedMillis(startTime);
            if (exitCode != 0) {
                LOG.error("SSO login failed for profile '{}' (exitCode={}, durationMs={})",
                        profile, exitCode, elapsedMs);
            } else {
                LOG.info("SSO login completed for profile '{}' in {} ms", profile, elapsedMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(process);
            LOG.error("Interrupted while waiting for SSO login for profile '{}'", profile);
        }
    }

    private Thread startGobbler(InputStream inputStream, String name) {
        Thread thread = new Thread(new LineForwarder(inputStream, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Forwards each line of a process stream to the log.
     */
    private static final class LineForwarder implements Runnable {
        private final InputStream inputStream;
        private final String name;

        LineForwarder(InputStream inputStream, String name) {
            this.inputStream = inputStream;
            this.name = name;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    if (!line.isBlank()) {
                        LOG.info("[{}] {}", name, line);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream forwarder '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread) {
        try {
            thread.join(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Login process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying login process");
        }
    }
}
