package io.xlsformem.core.model;

/**
 * Sealed AST for parsed XLSForm XPath expressions. One variant per node shape the transpiler
 * understands:
 *
 * <pre>
 * XPathNode
 * ├── FunctionCall (count(a), concat(a, b), ...)
 * ├── BinaryOp     (comparison, arithmetic, boolean and path-algebra operators)
 * ├── PathRef      (field references, '.', '..', '@attr', a/b)
 * └── Literal      (numbers, quoted strings, pre-rendered fragments)
 * </pre>
 *
 * <p>
 * Nodes are immutable. A tree is built per conversion by {@link
 * io.xlsformem.core.parser.XPathParser} and discarded afterwards.
 */
public sealed interface XPathNode permits FunctionCall, BinaryOp, PathRef, Literal {}
