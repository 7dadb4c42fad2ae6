package dev.gatekeeper.domain.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceLanguageTest {

    @Test
    void detectsByExtension() {
        assertThat(SourceLanguage.detect("app/main.py")).isEqualTo(SourceLanguage.PYTHON);
        assertThat(SourceLanguage.detect("src/Main.JAVA")).isEqualTo(SourceLanguage.JAVA);
        assertThat(SourceLanguage.detect("web/view.tsx")).isEqualTo(SourceLanguage.TYPESCRIPT);
    }

    @Test
    void unknownOrMissingExtensionIsText() {
        assertThat(SourceLanguage.detect("README.md")).isEqualTo(SourceLanguage.TEXT);
        assertThat(SourceLanguage.detect("Makefile")).isEqualTo(SourceLanguage.TEXT);
        assertThat(SourceLanguage.detect("config/.env")).isEqualTo(SourceLanguage.TEXT);
        assertThat(SourceLanguage.detect("dir.d/file")).isEqualTo(SourceLanguage.TEXT);
        assertThat(SourceLanguage.TEXT.isRecognizedSource()).isFalse();
    }

    @Test
    void mapsGitHubFileStatus() {
        assertThat(ChangeKind.fromGitHubStatus("added")).isEqualTo(ChangeKind.ADDED);
        assertThat(ChangeKind.fromGitHubStatus("removed")).isEqualTo(ChangeKind.REMOVED);
        assertThat(ChangeKind.fromGitHubStatus("renamed")).isEqualTo(ChangeKind.RENAMED);
        assertThat(ChangeKind.fromGitHubStatus("copied")).isEqualTo(ChangeKind.MODIFIED);
        assertThat(ChangeKind.fromGitHubStatus(null)).isEqualTo(ChangeKind.MODIFIED);
    }
}
