package specval.validator;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 合成模块声明的 clone id 来源。变换本身是确定性的，唯一的非确定输入由调用方提供。
 */
@FunctionalInterface
public interface IdSource {
  UUID next();

  static IdSource random() {
    return UUID::randomUUID;
  }

  /** 从 1 开始递增的确定性序列，测试用。 */
  static IdSource sequential() {
    AtomicLong counter = new AtomicLong();
    return () -> new UUID(0L, counter.incrementAndGet());
  }
}
