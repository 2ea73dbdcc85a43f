package org.janelia.seaflow.evt;

import java.util.Optional;

import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Test;

public class FileIdentityTest {

    @Test
    public void parseJulianPath() {
        FileIdentity identity = FileIdentity.parse("/data/cruise/2014_185/2014-07-04T00-00-02+00-00").orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(identity.getJulianDir(), Matchers.equalTo(Optional.of("2014_185")));
        MatcherAssert.assertThat(identity.getBaseName(), Matchers.equalTo("2014-07-04T00-00-02+00-00"));
        MatcherAssert.assertThat(identity.isCompressed(), Matchers.is(false));
        MatcherAssert.assertThat(identity.relativePath(), Matchers.equalTo("2014_185/2014-07-04T00-00-02+00-00"));
    }

    @Test
    public void compressionSuffixIsNotPartOfTheRelativePath() {
        FileIdentity identity = FileIdentity.parse("2014_185/2014-07-04T00-00-02+00-00.gz").orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(identity.isCompressed(), Matchers.is(true));
        MatcherAssert.assertThat(identity.relativePath(), Matchers.equalTo("2014_185/2014-07-04T00-00-02+00-00"));
    }

    @Test
    public void parseWithoutJulianDir() {
        FileIdentity identity = FileIdentity.parse("2014-07-04T00-00-02-0700").orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(identity.getJulianDir(), Matchers.equalTo(Optional.empty()));
        MatcherAssert.assertThat(identity.relativePath(), Matchers.equalTo("2014-07-04T00-00-02-0700"));
    }

    @Test
    public void parseLegacyName() {
        FileIdentity identity = FileIdentity.parse("evt/2011_001/42.evt").orElseThrow(AssertionError::new);
        MatcherAssert.assertThat(identity.getBaseName(), Matchers.equalTo("42.evt"));
        MatcherAssert.assertThat(identity.relativePath(), Matchers.equalTo("2011_001/42.evt"));
    }

    @Test
    public void rejectNonEvtNames() {
        MatcherAssert.assertThat(FileIdentity.isEvtFile("notes.txt"), Matchers.is(false));
        MatcherAssert.assertThat(FileIdentity.isEvtFile("2014_185/2014-07-04T00-00-02"), Matchers.is(false));
        MatcherAssert.assertThat(FileIdentity.isEvtFile("2014_185/2014-07-04T00-00-02+00-00.opp"), Matchers.is(false));
        MatcherAssert.assertThat(FileIdentity.isEvtFile(""), Matchers.is(false));
        MatcherAssert.assertThat(FileIdentity.isEvtFile(null), Matchers.is(false));
    }

    @Test
    public void fileKeyFallsBackToTheReference() {
        MatcherAssert.assertThat(FileIdentity.fileKey("/tmp/2014_185/2014-07-04T00-00-02+00-00.gz"), Matchers.equalTo("2014_185/2014-07-04T00-00-02+00-00"));
        MatcherAssert.assertThat(FileIdentity.fileKey("some/odd/name"), Matchers.equalTo("some/odd/name"));
    }
}
