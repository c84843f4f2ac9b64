package co.fanki.faex.analysis.domain;

import co.fanki.faex.analysis.domain.python.PythonParser;
import co.fanki.faex.analysis.domain.python.PythonSourceReader;
import co.fanki.faex.analysis.domain.python.PythonSyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SourceIndex}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SourceIndexTest {

    private static final Path ROUTES = Path.of("app/routes.py");

    private static final Path BROKEN = Path.of("app/broken.py");

    private PythonSourceReader reader;

    private SourceIndex index;

    @BeforeEach
    void setUp() {
        reader = createMock(PythonSourceReader.class);
        index = new SourceIndex(reader);
    }

    @Test
    void whenRegistering_givenSameFileTwice_shouldParseItOnce()
            throws Exception {
        expect(reader.read(ROUTES)).andReturn(PythonParser.parse("""
                class Service:
                    def load(self):
                        def inner():
                            pass

                def top():
                    pass
                """)).once();
        replay(reader);

        index.register(ROUTES);
        index.register(ROUTES);

        verify(reader);
        assertTrue(index.isRegistered(ROUTES));
        assertEquals(3, index.size());
        assertEquals("inner", index.lookup("inner").orElseThrow()
                .function().name());
        assertEquals(ROUTES, index.lookup("top").orElseThrow().file());
    }

    @Test
    void whenRegistering_givenUnparsableFile_shouldRegisterNothing()
            throws Exception {
        expect(reader.read(BROKEN)).andThrow(
                new PythonSyntaxException("invalid syntax", 1, 4)).once();
        replay(reader);

        index.register(BROKEN);
        index.register(BROKEN);

        verify(reader);
        assertTrue(index.isRegistered(BROKEN));
        assertEquals(0, index.size());
    }

    @Test
    void whenRegistering_givenDuplicateNames_shouldKeepTheLastDefinition()
            throws PythonSyntaxException {
        replay(reader);

        index.register(ROUTES, PythonParser.parse("""
                def helper():
                    pass

                def helper():
                    return 1
                """));

        assertEquals(1, index.size());
        assertEquals(4, index.lookup("helper").orElseThrow()
                .function().line());
    }

    @Test
    void whenLookingUp_givenUnknownName_shouldReturnEmpty() {
        replay(reader);

        assertTrue(index.lookup("missing").isEmpty());
        assertFalse(index.isRegistered(ROUTES));
    }

}
