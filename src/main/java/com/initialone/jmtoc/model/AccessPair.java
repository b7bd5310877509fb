package com.initialone.jmtoc.model;

/** {@code (SetAccess, GetAccess)} of a block; events use {@code (NotifyAccess, ListenAccess)}. */
public record AccessPair(Access setAccess, Access getAccess) {

    public static final AccessPair PUBLIC = new AccessPair(Access.PUBLIC, Access.PUBLIC);

    public boolean isSymmetric() {
        return setAccess == getAccess;
    }

    /** The region a member with this access is grouped under: where it can be read from. */
    public Access effective() {
        return getAccess;
    }
}
