package org.janelia.seaflow.app;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.janelia.seaflow.fetch.RemoteObjectStore;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class EvtFileListerTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void readReferencesFromStdin() throws IOException {
        String stdin = "2014_185/2014-07-04T00-03-02+00-00\n\n  2014_185/2014-07-04T00-00-02+00-00.gz  \nnotes.txt\n";
        EvtFileLister lister = new EvtFileLister(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));

        MatcherAssert.assertThat(lister.listFiles(ImmutableList.of("-")), Matchers.contains(
                "2014_185/2014-07-04T00-03-02+00-00",
                "2014_185/2014-07-04T00-00-02+00-00.gz"));
    }

    @Test
    public void explicitReferencesKeepTheirOrder() throws IOException {
        EvtFileLister lister = new EvtFileLister(new ByteArrayInputStream(new byte[0]));

        MatcherAssert.assertThat(lister.readReferences(ImmutableList.of("b/42.evt", "notes.txt", "a/7.evt")),
                Matchers.contains("b/42.evt", "notes.txt", "a/7.evt"));
        MatcherAssert.assertThat(lister.listFiles(ImmutableList.of("b/42.evt", "notes.txt", "a/7.evt")),
                Matchers.contains("b/42.evt", "a/7.evt"));
    }

    @Test
    public void listDirectoryRecursively() throws IOException {
        Path evtDir = testFolder.getRoot().toPath();
        Path second = AppTestData.write(evtDir, "2014_186/2014-07-05T00-00-02+00-00", new byte[0]);
        Path first = AppTestData.write(evtDir, "2014_185/2014-07-04T00-00-02+00-00.gz", new byte[0]);
        AppTestData.write(evtDir, "2014_185/sfl.tab", new byte[0]);

        List<String> files = new EvtFileLister().listDirectory(evtDir);

        MatcherAssert.assertThat(files, Matchers.contains(first.toString(), second.toString()));
    }

    @Test
    public void listRemoteCruise() {
        RemoteObjectStore remoteStore = mock(RemoteObjectStore.class);
        when(remoteStore.listObjects("SCOPE_1/")).thenReturn(ImmutableList.of(
                "SCOPE_1/2014_185/2014-07-04T00-00-02+00-00.gz",
                "SCOPE_1/2014_185/sfl.tab",
                "SCOPE_1/SCOPE_1.db",
                "SCOPE_1/2014_186/2014-07-05T00-00-02+00-00.gz"));

        List<String> files = new EvtFileLister().listRemote(remoteStore, "SCOPE_1");

        MatcherAssert.assertThat(files, Matchers.contains(
                "SCOPE_1/2014_185/2014-07-04T00-00-02+00-00.gz",
                "SCOPE_1/2014_186/2014-07-05T00-00-02+00-00.gz"));
    }

    @Test
    public void limitFiles() {
        List<String> files = ImmutableList.of("1.evt", "2.evt", "3.evt");
        MatcherAssert.assertThat(EvtFileLister.limit(files, Optional.of(2)), Matchers.contains("1.evt", "2.evt"));
        MatcherAssert.assertThat(EvtFileLister.limit(files, Optional.of(5)), Matchers.hasSize(3));
        MatcherAssert.assertThat(EvtFileLister.limit(files, Optional.empty()), Matchers.hasSize(3));
    }
}
