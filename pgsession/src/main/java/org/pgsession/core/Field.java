/*
 * Copyright (c) 2004, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgsession.core;

/**
 * Description of one column of a tabular result.
 *
 * <p>Sizes follow the backend conventions: the internal size is the on-wire size of fixed-width
 * types and the type modifier for variable-width ones. Precision and scale are only set for
 * {@code numeric} columns. Nullability is not known and always reported as null.</p>
 */
public class Field {
    private final String name;
    private final int typeOid;
    private final Integer displaySize;
    private final Integer internalSize;
    private final Integer precision;
    private final Integer scale;

    public Field(String name, int typeOid, Integer displaySize, Integer internalSize,
            Integer precision, Integer scale) {
        this.name = name;
        this.typeOid = typeOid;
        this.displaySize = displaySize;
        this.internalSize = internalSize;
        this.precision = precision;
        this.scale = scale;
    }

    public String getName() {
        return name;
    }

    public int getTypeOid() {
        return typeOid;
    }

    /**
     * @return the widest value of the column in bytes, or null if not computed
     */
    public Integer getDisplaySize() {
        return displaySize;
    }

    public Integer getInternalSize() {
        return internalSize;
    }

    public Integer getPrecision() {
        return precision;
    }

    public Integer getScale() {
        return scale;
    }

    public Boolean getNullOk() {
        return null;
    }

    @Override
    public String toString() {
        return "Field(" + name + "," + Oid.toString(typeOid) + "," + displaySize + ","
                + internalSize + "," + precision + "," + scale + ")";
    }
}
