/**
 * Attribute values: scalars, sets and one- and two-dimensional sequences. Every value validates
 * its contents on construction.
 */
package io.pdslabel.parser.api.values;
