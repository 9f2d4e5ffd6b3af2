package wavetrace.parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import wavetrace.parser.VerilogToken.Kind;

/**
 * Splits Verilog source text into tokens with recorded positions.
 * Comments and attribute instances {@code (* ... *)} are dropped. Everything that is not an identifier, number,
 * string, compiler directive or system identifier becomes a single character symbol.
 */
public class VerilogTokenizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Path file;
  private final String text;
  private int pos = 0;
  private int line = 1;
  private int lineStart = 0;

  /**
   * @param file used in diagnostics only, may be null
   * @param text the source text
   */
  public VerilogTokenizer(Path file, String text) {
    this.file = file;
    this.text = text;
  }

  public static List<VerilogToken> tokenize(Path file, String text) throws VerilogParseException {
    return new VerilogTokenizer(file, text).tokenize();
  }

  public List<VerilogToken> tokenize() throws VerilogParseException {
    List<VerilogToken> tokens = new ArrayList<>();
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '\n') {
        pos++;
        newLine();
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '/' && peek(1) == '/') {
        while (pos < text.length() && text.charAt(pos) != '\n')
          pos++;
      } else if (c == '/' && peek(1) == '*') {
        skipBlock("*/", "unterminated block comment");
      } else if (c == '(' && peek(1) == '*' && peek(2) != ')') {
        skipBlock("*)", "unterminated attribute instance");
      } else if (c == '"') {
        tokens.add(readString());
      } else if (isIdentStart(c)) {
        tokens.add(readWord(Kind.IDENTIFIER, pos));
      } else if (c == '$' && isIdentPart(peek(1))) {
        tokens.add(readWord(Kind.SYSTEM_IDENTIFIER, pos));
      } else if (c == '`' && isIdentStart(peek(1))) {
        tokens.add(readWord(Kind.DIRECTIVE, pos));
      } else if (c == '\\') {
        tokens.add(readEscapedIdentifier());
      } else if (Character.isDigit(c) || (c == '\'' && isBaseChar(peek(1)))) {
        tokens.add(readNumber());
      } else {
        tokens.add(new VerilogToken(Kind.SYMBOL, String.valueOf(c), line, column(pos)));
        pos++;
      }
    }
    logger.trace("Tokenized {}: {} tokens on {} lines", file, tokens.size(), line);
    return tokens;
  }

  private char peek(int offset) { return (pos + offset < text.length()) ? text.charAt(pos + offset) : '\0'; }

  private int column(int offset) { return offset - lineStart + 1; }

  private void newLine() {
    line++;
    lineStart = pos;
  }

  private void skipBlock(String terminator, String error) throws VerilogParseException {
    int startLine = line;
    pos += 2;
    while (pos < text.length()) {
      if (text.startsWith(terminator, pos)) {
        pos += terminator.length();
        return;
      }
      if (text.charAt(pos++) == '\n')
        newLine();
    }
    throw new VerilogParseException(file, startLine, error);
  }

  private VerilogToken readString() throws VerilogParseException {
    int start = pos;
    int startLine = line;
    int startCol = column(pos);
    pos++;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '\\') {
        if (peek(1) == '\n') {
          pos += 2;
          newLine();
          continue;
        }
        pos += 2;
        continue;
      }
      if (c == '\n')
        break;
      pos++;
      if (c == '"')
        return new VerilogToken(Kind.STRING, text.substring(start, pos), startLine, startCol);
    }
    throw new VerilogParseException(file, startLine, "unterminated string literal");
  }

  private VerilogToken readWord(Kind kind, int start) {
    int startCol = column(start);
    pos++;
    while (pos < text.length() && isIdentPart(text.charAt(pos)))
      pos++;
    return new VerilogToken(kind, text.substring(start, pos), line, startCol);
  }

  private VerilogToken readEscapedIdentifier() {
    int start = pos;
    while (pos < text.length() && !Character.isWhitespace(text.charAt(pos)))
      pos++;
    return new VerilogToken(Kind.IDENTIFIER, text.substring(start, pos), line, column(start));
  }

  private VerilogToken readNumber() {
    int start = pos;
    while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
      pos++;
    if (pos < text.length() && text.charAt(pos) == '.' && Character.isDigit(peek(1))) {
      pos++;
      while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
        pos++;
    }
    if (pos < text.length() && text.charAt(pos) == '\'' && isBaseChar(peek(1))) {
      pos++;
      if (Character.toLowerCase(text.charAt(pos)) == 's')
        pos++;
      pos++;
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos)) && text.charAt(pos) != '\n')
        pos++;
      while (pos < text.length() && isValueChar(text.charAt(pos)))
        pos++;
    }
    return new VerilogToken(Kind.NUMBER, text.substring(start, pos), line, column(start));
  }

  static boolean isIdentStart(char c) { return Character.isLetter(c) || c == '_'; }

  static boolean isIdentPart(char c) { return Character.isLetterOrDigit(c) || c == '_' || c == '$'; }

  private static boolean isBaseChar(char c) { return "sSbBoOdDhH".indexOf(c) >= 0 && c != '\0'; }

  private static boolean isValueChar(char c) { return Character.isLetterOrDigit(c) || c == '_' || c == '?'; }
}
