/**
 * Entities shared by every document kind. All of them extend {@link
 * io.kifmt.parser.api.model.Element}, which records how the source spelled them so that an
 * unmodified document is written back the way it was read.
 */
package io.kifmt.parser.api.model;
