package com.example.s3explorer;

import com.example.s3explorer.gateway.ContentTypeDetector;
import com.example.s3explorer.gateway.MutationGateway;
import com.example.s3explorer.gateway.MutationResult;
import com.example.s3explorer.internal.Json;
import com.example.s3explorer.naming.CircuitNameParser;
import com.example.s3explorer.policy.AccessPolicy;
import com.example.s3explorer.policy.Principal;
import com.example.s3explorer.session.AuthClient;
import com.example.s3explorer.session.AuthEndpoint;
import com.example.s3explorer.session.FileCredentialStore;
import com.example.s3explorer.session.RemoteExplorerClient;
import com.example.s3explorer.session.SessionExpiredException;
import com.example.s3explorer.session.SessionManager;
import com.example.s3explorer.storage.S3ObjectStorage;
import com.example.s3explorer.tree.VirtualTreeTranslator;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE = "Usage: java -jar s3-explorer.jar <config.json> "
            + "<tree [prefix] [page] | url <key> | upload <file> [folder] | mkdir <path> | rm <key> | prefixes | parse <name>"
            + " | login <email> <password> | logout | whoami | remote-tree [prefix]>";

    private static final Set<String> REMOTE_COMMANDS = Set.of("login", "logout", "whoami", "remote-tree");

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
        String command = args[1];
        ObjectWriter out = Json.mapper().writerWithDefaultPrettyPrinter();
        if (command.equals("parse")) {
            // Runs without touching storage.
            require(args, 3);
            System.out.println(out.writeValueAsString(CircuitNameParser.parse(args[2])));
            return;
        }

        ExplorerConfig config = new ConfigLoader().load(Path.of(args[0]));
        if (REMOTE_COMMANDS.contains(command)) {
            runRemote(config, command, args, out);
            return;
        }
        Principal principal = config.principal()
                .orElseThrow(() -> new IllegalArgumentException("Config must include a principal to run commands."));
        AccessPolicy policy = new AccessPolicy(config.sharedWritePrefix(), config.roleDefaultPrefixes());
        VirtualTreeTranslator translator = new VirtualTreeTranslator();

        try (S3ObjectStorage storage = new S3ObjectStorage(
                config.bucket(), config.region(), config.endpointOverride(), config.pathStyleAccess())) {
            MutationGateway gateway = new MutationGateway(storage, policy, new ContentTypeDetector(new Tika()),
                    config.allowedContentTypes(), config.maxUploadBytes());
            ExplorerService service = new ExplorerService(storage, policy, translator, gateway, config);
            try {
                Object result = run(service, principal, command, args);
                if (result instanceof MutationResult) {
                    MutationResult mutation = (MutationResult) result;
                    System.out.println(out.writeValueAsString(mutation(mutation)));
                    if (!mutation.isSuccess()) {
                        System.exit(2);
                    }
                } else {
                    System.out.println(out.writeValueAsString(result));
                }
            } catch (AccessDeniedException | ObjectNotFoundException ex) {
                LOGGER.error(ex.getMessage());
                System.exit(2);
            }
        }
    }

    private static Object run(ExplorerService service, Principal principal, String command, String[] args)
            throws Exception {
        switch (command) {
            case "tree": {
                String prefix = args.length > 2 ? args[2] : "";
                int pageNumber = args.length > 3 ? Integer.parseInt(args[3]) : 1;
                return service.browse(principal, prefix, pageNumber);
            }
            case "url":
                require(args, 3);
                return service.downloadUrl(principal, args[2], null);
            case "upload": {
                require(args, 3);
                Path file = Path.of(args[2]);
                String folder = args.length > 3 ? args[3] : null;
                return service.upload(principal, folder, file.getFileName().toString(), Files.readAllBytes(file));
            }
            case "mkdir":
                require(args, 3);
                return service.createFolder(principal, args[2]);
            case "rm":
                require(args, 3);
                return service.delete(principal, args[2]);
            case "prefixes":
                return service.pathPrefixes(principal);
            default:
                LOGGER.error(USAGE);
                System.exit(1);
                return null;
        }
    }

    private static void runRemote(ExplorerConfig config, String command, String[] args, ObjectWriter out)
            throws Exception {
        URI baseUri = config.apiBaseUrl()
                .orElseThrow(() -> new IllegalArgumentException("Config must include apiBaseUrl for remote commands."));
        HttpClient http = HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build();
        AuthEndpoint endpoint = new AuthEndpoint(http, baseUri, config.requestTimeout());
        SessionManager sessions = new SessionManager(http, new FileCredentialStore(config.credentialFile()), endpoint,
                reason -> LOGGER.warn("Session ended ({}); run login again", reason.description()));
        AuthClient auth = new AuthClient(endpoint, sessions);
        try {
            switch (command) {
                case "login":
                    require(args, 4);
                    auth.login(args[2], args[3]);
                    break;
                case "logout":
                    auth.logout();
                    break;
                case "whoami":
                    System.out.println(out.writeValueAsString(auth.me()));
                    break;
                default:
                    RemoteExplorerClient client = new RemoteExplorerClient(sessions, endpoint);
                    System.out.println(out.writeValueAsString(client.tree(args.length > 2 ? args[2] : "", null)));
                    break;
            }
        } catch (SessionExpiredException | ExplorerApiException ex) {
            LOGGER.error(ex.getMessage());
            System.exit(2);
        }
    }

    private static Map<String, Object> mutation(MutationResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("outcome", result.getOutcome());
        view.put("key", result.getKey());
        view.put("changed", result.isChanged());
        view.put("message", result.getMessage());
        return view;
    }

    private static void require(String[] args, int count) {
        if (args.length < count) {
            LOGGER.error(USAGE);
            System.exit(1);
        }
    }
}
