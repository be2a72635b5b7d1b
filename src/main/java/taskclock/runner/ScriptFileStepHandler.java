package taskclock.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import taskclock.model.Step;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a script file as a child process.
 *
 * The interpreter follows the suffix: {@code .sh} runs under {@code sh},
 * {@code .py} under {@code python3}, {@code .java} under the current JVM's
 * launcher; anything else is executed directly. Positional args follow the
 * script path, kwargs are passed as {@code --key=value}. The step's env is
 * added to the child's environment. Output is logged line by line.
 */
public class ScriptFileStepHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(ScriptFileStepHandler.class);

    @Override
    public Object execute(Step step) throws IOException, InterruptedException {
        List<String> command = command(step);
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(step.env());

        log.debug("Starting process: {}", command);
        Process process = builder.start();
        int exitCode;
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.info("[{}] {}", step.name(), line);
                }
            }
            exitCode = process.waitFor();
        } finally {
            if (process.isAlive()) {
                log.warn("Stopping process of step \"{}\" before it exited", step.name());
                process.destroy();
            }
        }
        if (exitCode != 0) {
            throw new StepExecutionException("Script " + step.run() + " exited with code " + exitCode);
        }
        return exitCode;
    }

    static List<String> command(Step step) {
        String script = step.run();
        List<String> command = new ArrayList<>(interpreter(script));
        command.add(script);
        for (Object arg : step.args()) {
            command.add(String.valueOf(arg));
        }
        for (Map.Entry<String, Object> option : step.kwargs().entrySet()) {
            command.add("--" + option.getKey() + "=" + render(option.getValue()));
        }
        return command;
    }

    static List<String> interpreter(String script) {
        String lower = script.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".sh")) {
            return List.of("sh");
        }
        if (lower.endsWith(".py")) {
            return List.of("python3");
        }
        if (lower.endsWith(".java")) {
            return List.of(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        }
        return List.of();
    }

    private static String render(Object value) {
        if (value instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }
}
