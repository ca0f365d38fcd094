package com.xbleey.grafanareporter.service;

import com.xbleey.grafanareporter.config.ReportDefaultsProperties;
import com.xbleey.grafanareporter.exception.PersistenceException;
import com.xbleey.grafanareporter.model.ReporterConfig;
import com.xbleey.grafanareporter.support.InMemoryReporterConfigRepository;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReporterConfigStoreTest {

    private static ReporterConfig storedConfig() {
        return ReporterConfig.builder()
                .grafanaUrl("https://grafana.example.com")
                .grafanaApiKey("ABCDEFGH")
                .smtpHost("smtp.example.com")
                .smtpPort(587)
                .smtpUser("reports@example.com")
                .smtpPassword("s3cretPassword")
                .smtpFrom("reports@example.com")
                .build();
    }

    @Test
    void readReturnsMaskedSecrets() {
        ReporterConfigStore store = new ReporterConfigStore(
                new InMemoryReporterConfigRepository(storedConfig()), new ReportDefaultsProperties());
        store.reload();

        ReporterConfig view = store.read();

        assertThat(view.getGrafanaApiKey()).isEqualTo("AB****GH");
        assertThat(view.getSmtpPassword()).isEqualTo("s3****rd");
        assertThat(view.getSmtpHost()).isEqualTo("smtp.example.com");
        assertThat(store.current().getGrafanaApiKey()).isEqualTo("ABCDEFGH");
    }

    @Test
    void updateWithMaskedSecretKeepsStoredSecret() {
        InMemoryReporterConfigRepository repository = new InMemoryReporterConfigRepository(storedConfig());
        ReporterConfigStore store = new ReporterConfigStore(repository, new ReportDefaultsProperties());
        store.reload();

        ReporterConfig incoming = store.read();
        incoming.setSmtpHost("smtp2.example.com");
        ReporterConfig returned = store.update(incoming);

        assertThat(store.current().getGrafanaApiKey()).isEqualTo("ABCDEFGH");
        assertThat(store.current().getSmtpPassword()).isEqualTo("s3cretPassword");
        assertThat(store.current().getSmtpHost()).isEqualTo("smtp2.example.com");
        assertThat(repository.getSaved().getGrafanaApiKey()).isEqualTo("ABCDEFGH");
        assertThat(returned.getGrafanaApiKey()).isEqualTo("AB****GH");
    }

    @Test
    void updateWithNewSecretReplacesIt() {
        ReporterConfigStore store = new ReporterConfigStore(
                new InMemoryReporterConfigRepository(storedConfig()), new ReportDefaultsProperties());
        store.reload();

        ReporterConfig incoming = store.read();
        incoming.setGrafanaApiKey("new-api-key");
        incoming.setSmtpPassword("");
        store.update(incoming);

        assertThat(store.current().getGrafanaApiKey()).isEqualTo("new-api-key");
        assertThat(store.current().getSmtpPassword()).isEmpty();
    }

    @Test
    void reloadFillsEmptyFieldsFromDefaults() {
        ReportDefaultsProperties defaults = new ReportDefaultsProperties();
        defaults.setSmtpHost("mail.internal");
        defaults.setSmtpPort("2525");
        defaults.setSmtpUser("robot@internal");
        defaults.setSmtpPassword("pw");
        ReporterConfigStore store = new ReporterConfigStore(new InMemoryReporterConfigRepository(), defaults);

        store.reload();

        ReporterConfig config = store.current();
        assertThat(config.getGrafanaUrl()).isEqualTo("http://localhost:3000");
        assertThat(config.getSmtpHost()).isEqualTo("mail.internal");
        assertThat(config.getSmtpPort()).isEqualTo(2525);
        assertThat(config.getSmtpFrom()).isEqualTo("robot@internal");
    }

    @Test
    void reloadKeepsPersistedValuesOverDefaults() {
        ReportDefaultsProperties defaults = new ReportDefaultsProperties();
        defaults.setSmtpHost("mail.internal");
        defaults.setSmtpPort("not-a-port");
        ReporterConfig persisted = storedConfig();
        persisted.setSmtpPort(0);
        ReporterConfigStore store = new ReporterConfigStore(new InMemoryReporterConfigRepository(persisted), defaults);

        store.reload();

        assertThat(store.current().getSmtpHost()).isEqualTo("smtp.example.com");
        assertThat(store.current().getSmtpPort()).isEqualTo(587);
    }

    @Test
    void failedSaveIsSurfacedButMemoryIsUpdated() {
        InMemoryReporterConfigRepository repository = new InMemoryReporterConfigRepository(storedConfig());
        ReporterConfigStore store = new ReporterConfigStore(repository, new ReportDefaultsProperties());
        store.reload();
        repository.setFailOnSave(true);

        ReporterConfig incoming = store.read();
        incoming.setGrafanaUrl("https://other.example.com");

        assertThatThrownBy(() -> store.update(incoming)).isInstanceOf(PersistenceException.class);
        assertThat(store.current().getGrafanaUrl()).isEqualTo("https://other.example.com");
    }
}
