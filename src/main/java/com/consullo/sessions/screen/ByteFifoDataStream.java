package com.consullo.sessions.screen;

import com.jediterm.terminal.TerminalDataStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * {@link TerminalDataStream} over an in-memory byte FIFO.
 *
 * <p>
 * Bytes are decoded as UTF-8 before they reach the emulator; a sequence split
 * across two feeds is held back until its remaining bytes arrive, and malformed
 * input becomes U+FFFD. Control bytes are ASCII and pass through unchanged.
 * An empty FIFO throws
 * {@link TerminalDataStream.EOF} instead of blocking; the emulator then stops
 * and resumes on the next feed.
 * </p>
 *
 * <p>
 * Only the coordinating thread touches a screen, so no locking is done here.
 * </p>
 */
final class ByteFifoDataStream implements TerminalDataStream {

  private final Deque<Character> pending = new ArrayDeque<>();
  private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE);
  private ByteBuffer undecoded = ByteBuffer.allocate(0);

  void append(byte[] data, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > data.length) {
      throw new IllegalArgumentException("Invalid offset/length.");
    }
    ByteBuffer in = ByteBuffer.allocate(undecoded.remaining() + length);
    in.put(undecoded).put(data, offset, length).flip();
    // UTF-8 never yields more chars than bytes
    CharBuffer out = CharBuffer.allocate(in.remaining());
    decoder.decode(in, out, false);
    out.flip();
    while (out.hasRemaining()) {
      pending.addLast(out.get());
    }
    undecoded = in.slice();
  }

  @Override
  public char getChar() throws IOException {
    Character next = pending.pollFirst();
    if (next == null) {
      throw new TerminalDataStream.EOF();
    }
    return next;
  }

  @Override
  public void pushChar(char c) throws IOException {
    pending.addFirst(c);
  }

  @Override
  public String readNonControlCharacters(int maxChars) throws IOException {
    StringBuilder sb = new StringBuilder();
    while (sb.length() < maxChars && !pending.isEmpty() && !isControl(pending.peekFirst())) {
      sb.append(pending.removeFirst().charValue());
    }
    return sb.toString();
  }

  @Override
  public void pushBackBuffer(char[] chars, int length) throws IOException {
    for (int i = length - 1; i >= 0; i--) {
      pending.addFirst(chars[i]);
    }
  }

  @Override
  public boolean isEmpty() {
    return pending.isEmpty();
  }

  private static boolean isControl(char c) {
    // C0 controls and DEL
    return c <= 0x1F || c == 0x7F;
  }
}
