package specval.core;

/** 子集类型 / newtype 的 witness 子句形式。 */
public enum WitnessKind { NONE, GHOST, COMPILED, OPT_OUT }
