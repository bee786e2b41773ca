package com.docformat.core.model;

/**
 * Kinds of documentation nodes.
 */
public enum NodeKind {
    /** Root of a documentation tree, usually unnamed */
    MODULE,

    /** Package or namespace */
    PACKAGE,

    /** Class declaration */
    CLASS,

    /** Interface declaration */
    INTERFACE,

    /** Enum class declaration */
    ENUM,

    /** Single constant of an enum class */
    ENUM_ITEM,

    /** Singleton object declaration */
    OBJECT,

    /** Constructor of a class */
    CONSTRUCTOR,

    /** Property or field */
    PROPERTY,

    /** Function or method */
    FUNCTION,

    /** Getter or setter of a property */
    PROPERTY_ACCESSOR,

    /** Parameter of a function or constructor */
    PARAMETER,

    /** Generic type parameter */
    TYPE_PARAMETER,

    /** Annotation declaration */
    ANNOTATION,

    /** Unknown or unclassified node */
    UNKNOWN
}
