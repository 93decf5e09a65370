package kvline.cli;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Interactive client: {@code KvlineCli [host] [port]}.
 * Sends each typed line and prints the reply. {@code EXIT} (any case) or end of input quits.
 */
public class KvlineCli {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;

    private final String host;
    private final int port;

    public KvlineCli(String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Runs the session. Returns 0 on a normal exit and 1 if the server could not be
     * reached or dropped the connection.
     */
    public int run(BufferedReader in, PrintStream out) {
        try (LineConnection connection = new LineConnection(host, port)) {
            out.println("Connected to Kvline at " + host + ":" + port + ". Type commands (e.g. SET key value, GET key). Type 'EXIT' to quit.");

            while (true) {
                out.print("> ");
                out.flush();
                String input = in.readLine();
                if (input == null) {
                    out.println();
                    return 0;
                }

                input = input.trim();
                if (input.toUpperCase(Locale.ROOT).equals("EXIT")) {
                    out.println("Exiting...");
                    return 0;
                }
                if (input.isEmpty()) continue;

                try {
                    out.println(connection.execute(input));
                } catch (EOFException e) {
                    out.println("Connection closed by server.");
                    return 1;
                }
            }
        } catch (IOException e) {
            out.println("Connection error: " + e.getMessage());
            return 1;
        }
    }

    public static void main(String[] args) {
        String host = args.length > 0 ? args[0] : DEFAULT_HOST;
        int port = DEFAULT_PORT;
        if (args.length > 1) {
            try {
                port = Integer.parseInt(args[1]);
            } catch (NumberFormatException e) {
                System.err.println("Invalid port: " + args[1]);
                System.exit(2);
            }
        }

        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(new KvlineCli(host, port).run(stdin, System.out));
    }
}
