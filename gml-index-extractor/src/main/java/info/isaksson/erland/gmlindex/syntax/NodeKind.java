package info.isaksson.erland.gmlindex.syntax;

/** Closed set of syntax-tree node variants the indexer understands. */
public enum NodeKind {
    IDENTIFIER,
    CALL_EXPRESSION,
    NEW_EXPRESSION,
    ASSIGNMENT,
    ENUM_DECLARATION,
    ENUM_MEMBER,
    FUNCTION_DECLARATION,
    MEMBER_EXPRESSION,
    /** Anything else: programs, blocks, statements, literals, operators. */
    CONTAINER
}
