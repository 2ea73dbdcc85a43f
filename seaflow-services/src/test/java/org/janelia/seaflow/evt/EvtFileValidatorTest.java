package org.janelia.seaflow.evt;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class EvtFileValidatorTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private EvtFileValidator validator;

    @Before
    public void setUp() {
        validator = new EvtFileValidator(new EvtCodec());
    }

    @Test
    public void validFile() throws IOException {
        Path evtFile = testFolder.getRoot().toPath().resolve("2014-07-04T00-00-02+00-00");
        Files.write(evtFile, EvtTestData.evtBytes(EvtTestData.sampleParticles()));
        EvtFileValidator.ValidationResult result = validator.validate(evtFile);
        MatcherAssert.assertThat(result.isOk(), Matchers.is(true));
        MatcherAssert.assertThat(result.getStatus(), Matchers.equalTo("OK"));
        MatcherAssert.assertThat(result.getEventCount(), Matchers.equalTo(6));
    }

    @Test
    public void truncatedFile() throws IOException {
        Path evtFile = testFolder.getRoot().toPath().resolve("2014-07-04T00-03-02+00-00");
        Files.write(evtFile, EvtTestData.evtBytes(3, EvtTestData.particle(1, 1, 1, 1)));
        EvtFileValidator.ValidationResult result = validator.validate(evtFile);
        MatcherAssert.assertThat(result.isOk(), Matchers.is(false));
        MatcherAssert.assertThat(result.getStatus(), Matchers.startsWith("File has incorrect number of data bytes"));
        MatcherAssert.assertThat(result.getEventCount(), Matchers.nullValue());
    }

    @Test
    public void fileNameIsCheckedBeforeContent() throws IOException {
        Path notEvtFile = testFolder.newFile("readme.txt").toPath();
        EvtFileValidator.ValidationResult result = validator.validate(notEvtFile);
        MatcherAssert.assertThat(result.getStatus(), Matchers.equalTo("Filename does not look like an EVT file"));
    }
}
