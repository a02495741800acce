package specval.validator;

import specval.core.ModuleDefinition;
import specval.core.Program;

/**
 * 模块接线的结果。
 *
 * @param program 挂上校验器子模块后的程序
 * @param referenceTwin 保留原行为的引用副本（模块名 Gen），不挂到程序上
 * @param validatorTwin 校验器副本（模块名 Valid）
 */
public record WiringResult(Program program, ModuleDefinition referenceTwin, ModuleDefinition validatorTwin) {}
