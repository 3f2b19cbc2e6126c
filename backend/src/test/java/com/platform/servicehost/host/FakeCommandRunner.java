package com.platform.servicehost.host;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stands in for the host tool binary. {@code install} and {@code uninstall} register and
 * unregister the service (named after the working directory) with a {@link FakeServiceControl}.
 */
public class FakeCommandRunner implements CommandRunner {

    private final FakeServiceControl serviceControl;
    private final List<List<String>> commands = new CopyOnWriteArrayList<>();
    private final Map<String, ProcessOutcome> scripted = new ConcurrentHashMap<>();

    public FakeCommandRunner(FakeServiceControl serviceControl) {
        this.serviceControl = serviceControl;
    }

    /**
     * Every later invocation of {@code verb} returns {@code outcome} without side effects.
     */
    public void script(String verb, ProcessOutcome outcome) {
        scripted.put(verb, outcome);
    }

    public List<List<String>> commands() {
        return List.copyOf(commands);
    }

    public long countVerb(String verb) {
        return commands.stream().filter(c -> c.get(c.size() - 1).equals(verb)).count();
    }

    @Override
    public ProcessOutcome run(List<String> command, Path workingDirectory, Duration timeout) {
        commands.add(List.copyOf(command));
        String verb = command.get(command.size() - 1);
        ProcessOutcome override = scripted.get(verb);
        if (override != null) {
            return override;
        }
        String serviceId = workingDirectory.getFileName().toString();
        if (verb.equals("install")) {
            serviceControl.register(serviceId);
        } else if (verb.equals("uninstall")) {
            serviceControl.unregister(serviceId);
        }
        return new ProcessOutcome(0, verb + " ok", "", false, 1);
    }
}
