package org.javai.bonsai.render;

import java.util.List;
import java.util.Objects;

/**
 * A rendered program plus the comment lines the caller wants ahead of it.
 *
 * @param header lines written verbatim before the program; each starts with {@code #}
 * @param body the rendered conditional program
 */
public record BonsaiProgram(List<String> header, String body) {

	public BonsaiProgram {
		header = header != null ? List.copyOf(header) : List.of();
		Objects.requireNonNull(body, "body");
		for (String line : header) {
			if (!line.startsWith("#")) {
				throw new IllegalArgumentException("Header line must start with '#': " + line);
			}
			if (line.indexOf('\n') >= 0 || line.indexOf('\r') >= 0) {
				throw new IllegalArgumentException("Header line must be a single line: " + line);
			}
		}
	}

	public String text() {
		StringBuilder text = new StringBuilder();
		for (String line : header) {
			text.append(line).append('\n');
		}
		return text.append(body).toString();
	}
}
