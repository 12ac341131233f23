package ai.p8ls.analyzer.ast;

/** One entry of a table constructor. */
public sealed interface TableField extends Node permits TableKey, TableKeyString, TableValue {

    Expression value();
}
