/** Document readers and writers behind {@link io.kifmt.parser.api.KiCadFormat}. */
package io.kifmt.parser.impl;
