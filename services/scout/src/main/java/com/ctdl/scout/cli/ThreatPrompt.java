package com.ctdl.scout.cli;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks the user to confirm a risky file type.
 * <p>
 * {@code PROMPTING} moves to {@code CONFIRMED} on {@code y} and to {@code ABORTED} on {@code n}.
 * Any other answer re-prompts. End of input counts as {@code n}.
 */
@Component
public class ThreatPrompt {

    static final String WARNING = "WARNING: Downloading this file type may expose you to a heightened security risk.\n"
            + "Press 'y' to proceed or 'n' to exit";
    static final String INVALID = "Error: Invalid option provided.";

    public enum State {
        PROMPTING,
        CONFIRMED,
        ABORTED
    }

    private BufferedReader stdin;

    public State confirm(PrintWriter out) {
        return confirm(stdin(), out);
    }

    public State confirm(BufferedReader in, PrintWriter out) {
        State state = State.PROMPTING;
        while (state == State.PROMPTING) {
            out.print(WARNING + ": ");
            out.flush();
            String answer = readLine(in);
            state = next(answer);
            if (state == State.PROMPTING) {
                out.println(INVALID);
            }
        }
        return state;
    }

    /**
     * @param answer one line of input, {@code null} at end of input
     */
    static State next(String answer) {
        if (answer == null) {
            return State.ABORTED;
        }
        return switch (answer.trim().toLowerCase(Locale.ROOT)) {
            case "y" -> State.CONFIRMED;
            case "n" -> State.ABORTED;
            default -> State.PROMPTING;
        };
    }

    private static String readLine(BufferedReader in) {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
    }

    private synchronized BufferedReader stdin() {
        if (stdin == null) {
            stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return stdin;
    }
}
