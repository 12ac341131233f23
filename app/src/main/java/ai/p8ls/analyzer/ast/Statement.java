package ai.p8ls.analyzer.ast;

public sealed interface Statement extends Node
        permits AssignmentStatement,
                LocalStatement,
                IfStatement,
                WhileStatement,
                RepeatStatement,
                ForNumericStatement,
                ForGenericStatement,
                FunctionDeclaration,
                ReturnStatement,
                BreakStatement,
                GotoStatement,
                LabelStatement,
                CallStatement,
                DoStatement,
                IncludeStatement {}
