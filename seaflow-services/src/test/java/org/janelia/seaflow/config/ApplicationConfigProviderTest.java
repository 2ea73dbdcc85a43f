package org.janelia.seaflow.config;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import com.google.common.collect.ImmutableMap;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ApplicationConfigProviderTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void bundledDefaults() {
        ApplicationConfig config = new ApplicationConfigProvider().fromDefaultResources().build();
        MatcherAssert.assertThat(config.getDoublePropertyValue("seaflow.filter.width", null), Matchers.equalTo(0.5));
        MatcherAssert.assertThat(config.getIntegerPropertyValue("seaflow.fetch.maxAttempts", null), Matchers.equalTo(5));
        MatcherAssert.assertThat(config.getStringPropertyValue("seaflow.fetch.baseURL"), Matchers.nullValue());
        MatcherAssert.assertThat(config.getLongPropertyValue("seaflow.unknown", 7L), Matchers.equalTo(7L));
    }

    @Test
    public void laterSourcesOverrideEarlierOnes() throws IOException {
        File configFile = testFolder.newFile("seaflow-test.properties");
        Files.write(configFile.toPath(),
                "seaflow.batch.workers=4\nseaflow.fetch.baseURL=https://seaflow.example.org\n".getBytes(StandardCharsets.UTF_8));

        ApplicationConfig config = new ApplicationConfigProvider()
                .fromDefaultResources()
                .fromFile(configFile.getAbsolutePath())
                .fromMap(ImmutableMap.of("seaflow.batch.workers", "8"))
                .build();

        MatcherAssert.assertThat(config.getIntegerPropertyValue("seaflow.batch.workers", 1), Matchers.equalTo(8));
        MatcherAssert.assertThat(config.getStringPropertyValue("seaflow.fetch.baseURL"), Matchers.equalTo("https://seaflow.example.org"));
        MatcherAssert.assertThat(config.getDoublePropertyValue("seaflow.filter.offset", null), Matchers.equalTo(0.0));
    }

    @Test
    public void missingSourcesAreIgnored() {
        ApplicationConfig config = new ApplicationConfigProvider()
                .fromResource("/no-such.properties")
                .fromFile(testFolder.getRoot().toPath().resolve("missing.properties").toString())
                .fromFile(null)
                .build();
        MatcherAssert.assertThat(config.asMap().isEmpty(), Matchers.is(true));
    }
}
