package specval.runtime;

import java.io.IOException;

/**
 * 程序树 JSON 格式错误。{@link #pointer()} 给出出错节点的 JSON Pointer。
 */
public class ProgramFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String pointer;

  public ProgramFormatException(String pointer, String message) {
    super(message);
    this.pointer = pointer;
  }

  public ProgramFormatException(String pointer, String message, Throwable cause) {
    super(message, cause);
    this.pointer = pointer;
  }

  public String pointer() {
    return pointer;
  }
}
