package kvline.cli;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Blocking client connection: writes one command line, reads one reply line.
 */
public class LineConnection implements AutoCloseable {
    private final Socket socket;
    private final OutputStream output;
    private final BufferedReader input;

    public LineConnection(String host, int port) throws IOException {
        this.socket = new Socket(host, port);
        this.output = socket.getOutputStream();
        this.input = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    }

    /** Sends {@code line} and returns the reply without its terminator. */
    public String execute(String line) throws IOException {
        output.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        output.flush();
        String reply = input.readLine();
        if (reply == null) {
            throw new EOFException("Server closed the connection");
        }
        return reply;
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
