package com.ctdl.scout.cli;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class ThreatPromptTest {

    private final ThreatPrompt prompt = new ThreatPrompt();

    @Test
    void yesConfirms() {
        StringWriter out = new StringWriter();

        ThreatPrompt.State state = prompt.confirm(input("y\n"), new PrintWriter(out));

        assertThat(state).isEqualTo(ThreatPrompt.State.CONFIRMED);
        assertThat(out.toString()).contains("WARNING: Downloading this file type may expose you to a heightened security risk.");
    }

    @Test
    void noAborts() {
        assertThat(prompt.confirm(input("n\n"), new PrintWriter(new StringWriter())))
                .isEqualTo(ThreatPrompt.State.ABORTED);
    }

    @Test
    void invalidAnswersRepromptUntilDecided() {
        StringWriter out = new StringWriter();

        ThreatPrompt.State state = prompt.confirm(input("maybe\nyes\n\n Y \n"), new PrintWriter(out));

        assertThat(state).isEqualTo(ThreatPrompt.State.CONFIRMED);
        assertThat(out.toString().split("Error: Invalid option provided.", -1)).hasSize(4);
        assertThat(out.toString().split("Press 'y' to proceed or 'n' to exit: ", -1)).hasSize(5);
    }

    @Test
    void endOfInputAborts() {
        assertThat(prompt.confirm(input("what\n"), new PrintWriter(new StringWriter())))
                .isEqualTo(ThreatPrompt.State.ABORTED);
    }

    @Test
    void transitions() {
        assertThat(ThreatPrompt.next("y")).isEqualTo(ThreatPrompt.State.CONFIRMED);
        assertThat(ThreatPrompt.next("N")).isEqualTo(ThreatPrompt.State.ABORTED);
        assertThat(ThreatPrompt.next("")).isEqualTo(ThreatPrompt.State.PROMPTING);
        assertThat(ThreatPrompt.next("yes")).isEqualTo(ThreatPrompt.State.PROMPTING);
        assertThat(ThreatPrompt.next(null)).isEqualTo(ThreatPrompt.State.ABORTED);
    }

    private static BufferedReader input(String text) {
        return new BufferedReader(new StringReader(text));
    }
}
