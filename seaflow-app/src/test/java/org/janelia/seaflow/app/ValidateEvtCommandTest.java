package org.janelia.seaflow.app;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import com.google.common.collect.ImmutableList;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.janelia.seaflow.evt.EvtCodec;
import org.janelia.seaflow.evt.EvtFileValidator;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ValidateEvtCommandTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    private ByteArrayOutputStream output;
    private ValidateEvtCommand command;
    private Path goodFile;
    private Path badFile;
    private Path notEvtFile;

    @Before
    public void setUp() throws IOException {
        output = new ByteArrayOutputStream();
        command = new ValidateEvtCommand(new EvtFileValidator(new EvtCodec()), new EvtFileLister(),
                new PrintStream(output, true, StandardCharsets.UTF_8.name()));
        Path evtDir = testFolder.getRoot().toPath();
        goodFile = AppTestData.writeEvtFile(evtDir, "2014_185/2014-07-04T00-00-02+00-00");
        badFile = AppTestData.write(evtDir, "2014_185/2014-07-04T00-03-02+00-00", new byte[0]);
        notEvtFile = AppTestData.write(evtDir, "2014_185/sfl.tab", new byte[] {1});
    }

    private String[] outputLines() throws IOException {
        return output.toString(StandardCharsets.UTF_8.name()).split(System.lineSeparator());
    }

    @Test
    public void reportOnlyFailures() throws IOException {
        ValidateEvtArgs args = new ValidateEvtArgs();
        args.files = ImmutableList.of(goodFile.toString(), badFile.toString(), notEvtFile.toString());

        int failed = command.run(args);

        MatcherAssert.assertThat(failed, Matchers.equalTo(2));
        MatcherAssert.assertThat(outputLines(), Matchers.arrayContaining(
                "path\tstatus",
                badFile + "\tFile is empty",
                notEvtFile + "\tFilename does not look like an EVT file",
                "1/3 files passed validation"));
    }

    @Test
    public void verboseReport() throws IOException {
        ValidateEvtArgs args = new ValidateEvtArgs();
        args.files = ImmutableList.of(goodFile.toString(), badFile.toString());
        args.verbose = true;
        args.noSummary = true;

        command.run(args);

        MatcherAssert.assertThat(outputLines(), Matchers.arrayContaining(
                "path\tstatus\tevents",
                goodFile + "\tOK\t6",
                badFile + "\tFile is empty\t-"));
    }

    @Test
    public void noHeader() throws IOException {
        ValidateEvtArgs args = new ValidateEvtArgs();
        args.files = ImmutableList.of(goodFile.toString());
        args.noHeader = true;
        args.verbose = true;

        MatcherAssert.assertThat(command.run(args), Matchers.equalTo(0));
        MatcherAssert.assertThat(outputLines(), Matchers.arrayContaining(
                goodFile + "\tOK\t6",
                "1/1 files passed validation"));
    }
}
