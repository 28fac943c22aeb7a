/** Statement tree: attributes, groups, objects and the containers that hold them. */
package io.pdslabel.parser.api.statements;
