package co.fanki.faex.analysis.domain.python;

import co.fanki.faex.analysis.domain.python.PythonAst.Module;
import co.fanki.faex.shared.Preconditions;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a Python file from disk and parses it.
 *
 * <p>Files are decoded strictly as UTF-8: a malformed byte sequence is
 * reported as a {@link SourceDecodingException} instead of being replaced,
 * so a file that Python itself would refuse is never analyzed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonSourceReader {

    /**
     * Reads and parses a source file.
     *
     * @param file the file to read
     * @return the parsed module
     * @throws SourceParseException if the file cannot be read, decoded or
     *         parsed
     */
    public Module read(final Path file) throws SourceParseException {
        Preconditions.requireNonNull(file, "File is required");
        return PythonParser.parse(decode(readBytes(file)));
    }

    private byte[] readBytes(final Path file) throws SourceReadException {
        try {
            return Files.readAllBytes(file);
        } catch (final IOException e) {
            throw new SourceReadException(e.getClass().getSimpleName() + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Decodes bytes as strict UTF-8.
     *
     * @param bytes the raw file content
     * @return the decoded text
     * @throws SourceDecodingException at the first malformed sequence
     */
    String decode(final byte[] bytes) throws SourceDecodingException {
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        final ByteBuffer in = ByteBuffer.wrap(bytes);
        final CharBuffer out = CharBuffer.allocate(bytes.length + 1);

        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            final int position = in.position();
            throw new SourceDecodingException(String.format(
                    "'utf-8' codec can't decode byte 0x%02x in position %d",
                    bytes[position] & 0xff, position), null);
        }

        out.flip();
        return out.toString();
    }

}
