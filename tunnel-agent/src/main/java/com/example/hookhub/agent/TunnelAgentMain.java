package com.example.hookhub.agent;

import com.example.hookhub.agent.history.HistoryItem;
import com.example.hookhub.agent.history.HistoryStore;
import com.example.hookhub.agent.profile.Profile;
import com.example.hookhub.agent.profile.Profiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Webhook Tunnel Agent
 * Connects to a remote hookhub server and forwards every webhook it relays to a local server.
 * <p>
 * Commands:
 * <pre>
 *   connect [--profile=name] | connect --server=ws://.. --secret=.. --target=http://..
 *   profiles list | profiles add [name] --remote=.. --secret=.. --local=.. | profiles delete name
 *   history list | history delete id | history clear | history replay id [--local=http://..]
 * </pre>
 */
@Slf4j
public class TunnelAgentMain {

    private static final Duration RECONNECT_DELAY = Duration.ofSeconds(5);

    private final Path home;
    private final PrintStream out;
    private final PrintStream err;

    TunnelAgentMain(Path home, PrintStream out, PrintStream err) {
        this.home = home;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        TunnelAgentMain main = new TunnelAgentMain(resolveHome(), System.out, System.err);
        System.exit(main.run(args));
    }

    /**
     * @return process exit status
     */
    int run(String[] args) {
        List<String> positional = positional(args);
        if (positional.isEmpty()) {
            usage();
            return 1;
        }

        try {
            switch (positional.get(0)) {
                case "connect":
                    return connect(args);
                case "profiles":
                    return profiles(args, positional);
                case "history":
                    return history(args, positional);
                default:
                    err.println("Unknown command: " + positional.get(0));
                    usage();
                    return 1;
            }
        } catch (IllegalArgumentException | IllegalStateException | IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int connect(String[] args) throws IOException {
        Profile profile = connectProfile(args).prepare();

        out.println("========================================");
        out.println("  Webhook Tunnel Agent");
        out.println("========================================");
        out.println("Server: " + profile.getRemote());
        out.println("Local target: " + profile.getLocal());
        out.println("========================================");

        LocalForwarder forwarder = new LocalForwarder();
        TunnelAgent agent = new TunnelAgent(profile.remoteUri(), profile.getSecret(), profile.localUri(),
                forwarder, new HistoryStore(home), RECONNECT_DELAY);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.warn("[Agent] Interrupt received, shutting down");
            agent.stop();
            closeQuietly(forwarder);
        }, "TunnelShutdown"));

        agent.start();
        try {
            agent.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return agent.getRejectionReason() == null ? 0 : 1;
    }

    private Profile connectProfile(String[] args) throws IOException {
        String server = getArg(args, "--server", System.getenv("HOOKHUB_REMOTE"));
        if (server != null) {
            return new Profile(server,
                    getArg(args, "--secret", System.getenv("HOOKHUB_SECRET")),
                    getArg(args, "--target", System.getenv("HOOKHUB_LOCAL")));
        }

        String name = getArg(args, "--profile", Profiles.DEFAULT_PROFILE);
        return Profiles.load(home).get(name)
                .orElseThrow(() -> new IllegalArgumentException("Profile " + name + " doesn't exist"));
    }

    private int profiles(String[] args, List<String> positional) throws IOException {
        String action = positional.size() > 1 ? positional.get(1) : "list";
        Profiles profiles = Profiles.load(home);

        switch (action) {
            case "list":
                if (profiles.list().isEmpty()) {
                    out.println("No profiles");
                }
                for (Map.Entry<String, Profile> entry : profiles.list().entrySet()) {
                    out.println("[" + entry.getKey() + "] Remote: " + entry.getValue().getRemote()
                            + " Local: " + entry.getValue().getLocal());
                }
                return 0;
            case "add": {
                String name = positional.size() > 2 ? positional.get(2) : Profiles.DEFAULT_PROFILE;
                Profile profile = new Profile(
                        getArg(args, "--remote", null),
                        getArg(args, "--secret", null),
                        getArg(args, "--local", null));
                // fail early on bad URLs rather than at connect time
                profile.prepare();
                profiles.add(name, profile);
                out.println("Profile " + name + " added");
                return 0;
            }
            case "delete": {
                String name = required(positional, 2, "profile name");
                profiles.delete(name);
                out.println("Profile " + name + " deleted");
                return 0;
            }
            default:
                err.println("Unknown profiles command: " + action);
                return 1;
        }
    }

    private int history(String[] args, List<String> positional) throws IOException {
        String action = positional.size() > 1 ? positional.get(1) : "list";
        HistoryStore history = new HistoryStore(home);

        switch (action) {
            case "list": {
                List<HistoryItem> items = history.list();
                if (items.isEmpty()) {
                    out.println("History is empty");
                }
                for (HistoryItem item : items) {
                    out.println("[" + item.getId() + " " + item.getReceivedAt() + "] "
                            + item.getMethod() + " " + item.getFullPath());
                }
                return 0;
            }
            case "delete": {
                String id = required(positional, 2, "history id");
                if (!history.delete(id)) {
                    err.println(id + " not found");
                    return 1;
                }
                out.println("Item deleted");
                return 0;
            }
            case "clear":
                out.println("History has been cleared (" + history.clear() + " item(s))");
                return 0;
            case "replay": {
                String id = required(positional, 2, "history id");
                Optional<HistoryItem> item = history.get(id);
                if (item.isEmpty()) {
                    err.println(id + " not found");
                    return 1;
                }
                String local = getArg(args, "--local", item.get().getLocal());
                URI localOrigin = URI.create(Profile.localOrigin(local));
                try (LocalForwarder forwarder = new LocalForwarder()) {
                    ForwardResult result = forwarder.forward(item.get().toRequest(), localOrigin);
                    out.println("Replayed " + id + ": " + result);
                    return result.isSuccess() ? 0 : 1;
                }
            }
            default:
                err.println("Unknown history command: " + action);
                return 1;
        }
    }

    private void usage() {
        err.println("Usage:");
        err.println("  connect [--profile=name]");
        err.println("  connect --server=ws://host/ --secret=... --target=http://localhost:3000");
        err.println("  profiles list | add [name] --remote=... --secret=... --local=... | delete <name>");
        err.println("  history list | delete <id> | clear | replay <id> [--local=http://...]");
    }

    static Path resolveHome() {
        String configured = System.getenv("HOOKHUB_HOME");
        if (configured != null && !configured.isEmpty()) {
            return Paths.get(configured);
        }
        return Paths.get(System.getProperty("user.home"), ".hookhub");
    }

    static String getArg(String[] args, String key, String defaultValue) {
        for (String arg : args) {
            if (arg.startsWith(key + "=")) {
                return arg.substring(key.length() + 1);
            }
        }
        return defaultValue;
    }

    static List<String> positional(String[] args) {
        List<String> values = new ArrayList<>();
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                values.add(arg);
            }
        }
        return values;
    }

    private static String required(List<String> positional, int index, String what) {
        if (positional.size() <= index) {
            throw new IllegalArgumentException("Missing " + what);
        }
        return positional.get(index);
    }

    private static void closeQuietly(LocalForwarder forwarder) {
        try {
            forwarder.close();
        } catch (IOException e) {
            log.debug("[Agent] Error closing HTTP client: {}", e.getMessage());
        }
    }
}
