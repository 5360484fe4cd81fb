package com.ctdl.scout.service.download;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FileNameResolverTest {

    @TempDir
    Path directory;

    @Test
    void usesDecodedLastPathSegment() {
        assertThat(FileNameResolver.deriveName("http://a.example/papers/Deep%20Learning.pdf?dl=1"))
                .isEqualTo("Deep Learning.pdf");
        assertThat(FileNameResolver.deriveName("https://a.example/c++/notes+v2.pdf")).isEqualTo("notes+v2.pdf");
    }

    @Test
    void fallsBackToHostAndHashWithoutPathSegment() {
        String name = FileNameResolver.deriveName("http://files.example.com/");

        assertThat(name).startsWith("files.example.com-").hasSize("files.example.com-".length() + 12);
        assertThat(FileNameResolver.deriveName("http://files.example.com/")).isEqualTo(name);
        assertThat(FileNameResolver.deriveName("http://files.example.com/?id=2")).isNotEqualTo(name);
    }

    @Test
    void keepsPercentSignsThatAreNotEscapes() {
        assertThat(FileNameResolver.deriveName("http://example.com/100%.pdf")).isEqualTo("100%.pdf");
        assertThat(FileNameResolver.deriveName("http://example.com/x%2.pdf")).isEqualTo("x%2.pdf");
        assertThat(FileNameResolver.deriveName("http://example.com/a b/50%off.pdf")).isEqualTo("50%off.pdf");
        assertThat(FileNameResolver.deriveName("http://example.com/50%25%20off.pdf")).isEqualTo("50% off.pdf");
    }

    @Test
    void replacesCharactersThatCannotAppearInFileNames() {
        assertThat(FileNameResolver.deriveName("http://a.example/x%3Ay%7C.pdf")).isEqualTo("x_y_.pdf");
    }

    @Test
    void claimedNamesAreNeverHandedOutTwice() {
        FileNameResolver resolver = new FileNameResolver();

        Path first = resolver.claim(directory, "http://a.example/book.pdf");
        Path second = resolver.claim(directory, "http://b.example/book.pdf");
        Path third = resolver.claim(directory, "http://c.example/book.pdf");

        assertThat(first).isEqualTo(directory.resolve("book.pdf"));
        assertThat(second).isEqualTo(directory.resolve("book-1.pdf"));
        assertThat(third).isEqualTo(directory.resolve("book-2.pdf"));
    }

    @Test
    void existingFilesAreNotOverwritten() throws IOException {
        Files.createFile(directory.resolve("book.pdf"));

        assertThat(new FileNameResolver().claim(directory, "http://a.example/book.pdf"))
                .isEqualTo(directory.resolve("book-1.pdf"));
    }

    @Test
    void releasedNameCanBeReused() {
        FileNameResolver resolver = new FileNameResolver();
        Path first = resolver.claim(directory, "http://a.example/book.pdf");

        resolver.release(first);

        assertThat(resolver.claim(directory, "http://b.example/book.pdf")).isEqualTo(first);
    }
}
