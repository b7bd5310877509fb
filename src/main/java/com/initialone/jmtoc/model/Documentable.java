package com.initialone.jmtoc.model;

/** Something documentation comments can be bound to: the class or one of its members. */
public interface Documentable {

    /** Name used in diagnostics and in explicit {@code @var}/{@code @fn} tags. */
    String name();

    /** First line of the declaration. */
    int startLine();

    /** Last line of the declaration's signature; trailing comments start here or on the next line. */
    int anchorLine();

    Documentation documentation();
}
