package com.paxkun.binder.service.merge;

import com.paxkun.binder.service.merge.exception.PathRejectedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PathValidatorTest {

    @TempDir
    Path baseDir;

    @Test
    void acceptsPlainAndNestedNames() {
        PathValidator validator = PathValidator.within(baseDir);

        assertThat(validator.validate("001.jpg").ok()).isTrue();
        assertThat(validator.validate("chapter 1/002.png").ok()).isTrue();
        assertThat(validator.validate("./003.png").ok()).isTrue();
    }

    @Test
    void rejectsParentSegments() {
        PathValidator validator = PathValidator.within(baseDir);

        assertThat(validator.validate("../../etc/passwd.jpg").ok()).isFalse();
        assertThat(validator.validate("pages/../../escape.jpg").ok()).isFalse();
        assertThat(validator.validate("pages\\..\\escape.jpg").ok()).isFalse();
    }

    @Test
    void rejectsAbsoluteAndDriveNames() {
        PathValidator validator = PathValidator.within(baseDir);

        assertThat(validator.validate("/etc/passwd.jpg").ok()).isFalse();
        assertThat(validator.validate("\\windows\\evil.jpg").ok()).isFalse();
        assertThat(validator.validate("C:evil.jpg").ok()).isFalse();
        assertThat(validator.validate("c:/evil.jpg").ok()).isFalse();
    }

    @Test
    void rejectsEmptyAndNulNames() {
        assertThat(PathValidator.checkName("").ok()).isFalse();
        assertThat(PathValidator.checkName("   ").ok()).isFalse();
        assertThat(PathValidator.checkName("a\0.jpg").ok()).isFalse();
        assertThat(PathValidator.checkName(null).reason()).isEqualTo("Entry name is empty");
    }

    @Test
    void dotsInsideNamesAreNotParentSegments() {
        assertThat(PathValidator.checkName("..hidden.jpg").ok()).isTrue();
        assertThat(PathValidator.checkName("page..2.jpg").ok()).isTrue();
    }

    @Test
    void resolvedPathsStayInsideBaseDirectory() {
        PathValidator validator = PathValidator.within(baseDir);

        Path resolved = validator.resolveWithin("nested/./page.jpg");

        assertThat(validator.baseDir()).isEqualTo(baseDir.toAbsolutePath().normalize());
        assertThat(resolved).startsWithRaw(validator.baseDir());
        assertThat(resolved.getFileName().toString()).isEqualTo("page.jpg");
    }

    @Test
    void resolveWithinThrowsForRejectedNames() {
        PathValidator validator = PathValidator.within(baseDir);

        assertThatThrownBy(() -> validator.resolveWithin("../outside.jpg"))
                .isInstanceOf(PathRejectedException.class)
                .hasMessageContaining("../outside.jpg");
    }

    @Test
    void rejectsEscapeThroughSymbolicLink(@TempDir Path outside) throws IOException {
        Path link = baseDir.resolve("link");
        try {
            Files.createSymbolicLink(link, outside);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links unavailable: " + e.getMessage());
        }

        PathValidator validator = PathValidator.within(baseDir);

        assertThat(validator.validate("link/page.jpg").ok()).isFalse();
        assertThat(validator.validate("real/page.jpg").ok()).isTrue();
    }
}
