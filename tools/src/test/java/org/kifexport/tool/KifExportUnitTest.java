package org.kifexport.tool;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.kifexport.test.CsvMatchers.hasDataRecords;
import static org.kifexport.test.CsvMatchers.hasHeader;
import static org.kifexport.test.CsvMatchers.hasRecord;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kifexport.parser.ParseException;
import org.kifexport.test.KifSamples;
import org.kifexport.tool.export.CsvTableWriter;

public class KifExportUnitTest {
    @Rule
    public final TemporaryFolder temp = new TemporaryFolder();

    @Test
    public void fact() throws IOException {
        Path out = temp.getRoot().toPath().resolve("out");
        export(KifSamples.FIDO_IS_A_DOG, out, false);

        String concepts = read(out, CsvTableWriter.CONCEPTS);
        assertThat(concepts, hasHeader("id", "name"));
        assertThat(concepts, hasRecord("1", "instance"));
        assertThat(concepts, hasRecord("2", "Fido"));
        assertThat(concepts, hasRecord("3", "Dog"));
        assertThat(read(out, CsvTableWriter.RELATIONS), hasRecord("2", "1", "3"));
        assertThat(read(out, CsvTableWriter.EXPRESSIONS), hasRecord("1", "(instance Fido Dog)"));
    }

    @Test
    public void inferredRelationsAreWritten() throws IOException {
        Path out = temp.newFolder().toPath();
        PipelineResult result = export(KifSamples.DOGS_ARE_MAMMALS, out, true);
        assertThat(result.getInferred()).isEqualTo(1);
        assertThat(read(out, CsvTableWriter.RELATIONS), hasDataRecords(2));
        assertThat(read(out, CsvTableWriter.EXPRESSIONS), hasHeader("id", "source_text", "root_concept_id"));
    }

    @Test
    public void nothingIsWrittenWhenParsingFails() throws IOException {
        Path out = temp.getRoot().toPath().resolve("out");
        assertThatThrownBy(() -> export(KifSamples.UNCLOSED, out, false))
                .isInstanceOf(ParseException.class);
        assertThat(Files.exists(out)).isFalse();
    }

    @Test
    public void emptyInputWritesHeaders() throws IOException {
        Path out = temp.getRoot().toPath().resolve("out");
        export(KifSamples.EMPTY, out, false);
        assertThat(read(out, CsvTableWriter.EXPRESSIONS), hasDataRecords(0));
        assertThat(read(out, CsvTableWriter.CONCEPTS), hasDataRecords(0));
        assertThat(read(out, CsvTableWriter.RELATIONS), hasDataRecords(0));
    }

    @Test
    public void inputIsClosed() throws IOException {
        Reader from = spy(new StringReader(KifSamples.FIDO_IS_A_DOG));
        new KifExport(KifPipeline.builder().build(), from,
                new CsvTableWriter(CliUtils.directory(temp.getRoot().toString()), false)).run();
        verify(from).close();
    }

    private PipelineResult export(String kif, Path out, boolean expressionRoots) throws IOException {
        CsvTableWriter writer = new CsvTableWriter(CliUtils.directory(out.toString()), expressionRoots);
        return new KifExport(KifPipeline.builder().build(), new StringReader(kif), writer).run();
    }

    private static String read(Path out, String table) throws IOException {
        return new String(Files.readAllBytes(out.resolve(table)), UTF_8);
    }
}
