package org.ebpfverifier.cfa;

import org.ebpfverifier.asm.Statement;
import org.ebpfverifier.util.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a control flow graph in the graphviz dot format.
 */
public final class DotPrinter {

	private static final Logger logger = Logger.getLogger(DotPrinter.class);

	private DotPrinter() {
	}

	public static String toDot(Cfg<?> cfg) {
		final StringBuilder dotFile = new StringBuilder();
		final StringBuilder edges = new StringBuilder();
		dotFile.append("digraph G {\n");
		dotFile.append("node[shape=rectangle,style=filled,fillcolor=lightsteelblue,color=lightsteelblue]\n");
		cfg.dfs(bb -> {
			dotFile.append('"').append(bb.getLabel()).append("\"[label=\"").append(bb.getLabel()).append(":\\l");
			for (Statement s : bb) {
				dotFile.append(escape(s.toString())).append("\\l");
			}
			dotFile.append("\"];\n");
			for (Label n : bb.nextBlocks()) {
				edges.append('"').append(bb.getLabel()).append("\" -> \"").append(n).append("\";\n");
			}
		});
		dotFile.append(edges);
		dotFile.append("}\n");
		return dotFile.toString();
	}

	public static void write(Cfg<?> cfg, Path file) throws IOException {
		byte[] data = toDot(cfg).getBytes(StandardCharsets.UTF_8);
		try (OutputStream os = Files.newOutputStream(file)) {
			os.write(data);
		}
		logger.info("Wrote CFG with " + cfg.size() + " blocks to " + file);
	}

	private static String escape(String s) {
		return s.replace("\\", "\\\\").replace("\"", "\\\"");
	}
}
