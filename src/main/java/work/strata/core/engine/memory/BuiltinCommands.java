package work.strata.core.engine.memory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Small coreutils-like programs available to every in-memory engine, reachable both by bare name
 * and by their usual absolute path.
 */
public final class BuiltinCommands {
    private BuiltinCommands() {}

    public static Map<String, SimulatedCommand> defaults() {
        var commands = new LinkedHashMap<String, SimulatedCommand>();
        install(commands, "/bin/true", process -> 0);
        install(commands, "/bin/false", process -> 1);
        install(commands, "/bin/echo", BuiltinCommands::echo);
        install(commands, "/bin/cat", BuiltinCommands::cat);
        install(commands, "/bin/pwd", process -> {
            process.out("/" + process.cwd() + "\n");
            return 0;
        });
        install(commands, "/usr/bin/env", BuiltinCommands::env);
        install(commands, "/usr/bin/touch", BuiltinCommands::touch);
        install(commands, "/usr/bin/tee", BuiltinCommands::tee);
        install(commands, "/bin/rm", BuiltinCommands::rm);
        install(commands, "/bin/exit", BuiltinCommands::exit);
        return commands;
    }

    private static void install(Map<String, SimulatedCommand> commands, String path, SimulatedCommand command) {
        commands.put(path, command);
        commands.put(path.substring(path.lastIndexOf('/') + 1), command);
    }

    private static int echo(SimulatedProcess process) {
        List<String> args = process.args().subList(1, process.args().size());
        process.out(String.join(" ", args) + "\n");
        return 0;
    }

    private static int cat(SimulatedProcess process) {
        if (process.args().size() == 1) {
            process.out(process.stdin());
            return 0;
        }
        int code = 0;
        for (String path : process.args().subList(1, process.args().size())) {
            var content = process.readFile(path);
            if (content.isEmpty()) {
                process.err("cat: " + path + ": No such file or directory\n");
                code = 1;
                continue;
            }
            process.out(content.get());
        }
        return code;
    }

    private static int env(SimulatedProcess process) {
        new TreeMap<>(process.env()).forEach((name, value) -> process.out(name + "=" + value + "\n"));
        return 0;
    }

    private static int touch(SimulatedProcess process) {
        for (String path : process.args().subList(1, process.args().size())) {
            if (!process.exists(path)) {
                process.writeFile(path, new byte[0]);
            }
        }
        return 0;
    }

    /**
     * Copies stdin to every named file and to stdout.
     */
    private static int tee(SimulatedProcess process) {
        byte[] input = process.stdin();
        for (String path : process.args().subList(1, process.args().size())) {
            process.writeFile(path, input);
        }
        process.out(input);
        return 0;
    }

    private static int rm(SimulatedProcess process) {
        int code = 0;
        for (String path : process.args().subList(1, process.args().size())) {
            if (!process.deleteFile(path)) {
                process.err("rm: cannot remove '" + path + "': No such file or directory\n");
                code = 1;
            }
        }
        return code;
    }

    private static int exit(SimulatedProcess process) {
        if (process.args().size() < 2) {
            return 0;
        }
        try {
            return Integer.parseInt(process.args().get(1));
        } catch (NumberFormatException ex) {
            process.err("exit: " + process.args().get(1) + ": numeric argument required\n");
            return 2;
        }
    }
}
