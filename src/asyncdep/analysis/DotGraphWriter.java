package asyncdep.analysis;

import asyncdep.hir.ChannelEvent;
import asyncdep.hir.ChannelPutEvent;
import asyncdep.hir.PrintTools;

import java.io.*;
import java.util.*;

/**
* Writes dependency graphs in dot format. Every graph of a tree goes to its
* own file: <b>host.dot</b> for the host graph, <b>launch_0.dot</b> for the
* first child of host, <b>partition_0_1.dot</b> for the second child of that
* graph, and so on. The flat export puts the whole tree into
* <b>graph.dot</b>, one cluster per hierarchy graph.
* <p>
* Failures to write are reported and never thrown.
*/
public final class DotGraphWriter {

    private DotGraphWriter() {
    }

    /**
    * Returns the directory the graphs are written to: the named directory,
    * created if needed, or null for the current directory if it cannot be
    * created.
    */
    public static File getOutputDirectory(String dirname) {
        if (dirname == null || dirname.length() == 0) {
            return null;
        }
        File dir = new File(dirname);
        if (!dir.isDirectory() && !dir.mkdirs()) {
            PrintTools.printlnWarning("cannot create directory " + dirname
                    + "; writing graphs to the current directory", 0);
            return null;
        }
        return dir;
    }

    /**
    * Writes every graph of the tree to its own file.
    *
    * @param host the root of the tree.
    * @param dirname the output directory.
    * @param prefix prepended to every file name, e.g. "built_".
    * @return the files written.
    */
    public static List<File> dumpGraphs(ScopeGraph host, String dirname,
            String prefix) {
        File dir = getOutputDirectory(dirname);
        List<File> ret = new ArrayList<File>();
        File file = new File(dir, prefix + "host.dot");
        if (write(file, host.toDot("host"))) {
            ret.add(file);
        }
        List<ScopeGraph> children = host.getSubgraphs();
        for (int i = 0; i < children.size(); i++) {
            dumpGraphs(children.get(i), dir, prefix, "_" + i, ret);
        }
        return ret;
    }

    private static void dumpGraphs(ScopeGraph g, File dir, String prefix,
            String path, List<File> files) {
        String name = g.getLevelName() + path;
        File file = new File(dir, prefix + name + ".dot");
        if (write(file, g.toDot(name))) {
            files.add(file);
        }
        List<ScopeGraph> children = g.getSubgraphs();
        for (int i = 0; i < children.size(); i++) {
            dumpGraphs(children.get(i), dir, prefix, path + "_" + i, files);
        }
    }

    /**
    * Writes the whole tree into <b>graph.dot</b> in the output directory.
    *
    * @return the file, or null if it could not be written.
    */
    public static File dumpFlatGraph(ScopeGraph host, String dirname) {
        File file = new File(getOutputDirectory(dirname), "graph.dot");
        return write(file, toFlatDot(host)) ? file : null;
    }

    /**
    * Returns the flat dot rendering of the tree. Each hierarchy vertex gets
    * an edge to the start vertex of its graph, and channel puts get dashed
    * edges to the gets of the same channel.
    */
    public static String toFlatDot(ScopeGraph host) {
        Map<GraphVertex, String> names = new HashMap<GraphVertex, String>();
        Map<String, Integer> cluster_counters = new HashMap<String, Integer>();
        List<GraphVertex> channels = new ArrayList<GraphVertex>();
        StringBuilder str = new StringBuilder();
        String sep = PrintTools.line_sep;
        str.append("digraph G {").append(sep);
        str.append("  rankdir=LR;").append(sep);
        appendGraph(host, "  ", names, cluster_counters, channels, str);

        for (GraphVertex put : channels) {
            if (!(put.getOp() instanceof ChannelPutEvent)) {
                continue;
            }
            String channel_name = ((ChannelEvent)put.getOp()).getChannelName();
            boolean paired = false;
            for (GraphVertex get : channels) {
                if (get.getOp() instanceof ChannelPutEvent) {
                    continue;
                }
                if (((ChannelEvent)get.getOp()).getChannelName()
                        .equals(channel_name)) {
                    str.append("  ").append(names.get(put)).append(" -> ");
                    str.append(names.get(get)).append(" [style=\"dashed\"];");
                    str.append(sep);
                    paired = true;
                }
            }
            if (!paired) {
                PrintTools.printlnWarning("channel @" + channel_name
                        + " has no get in the graphs", 1);
            }
        }
        str.append("}").append(sep);
        return str.toString();
    }

    private static void appendGraph(ScopeGraph g, String indent,
            Map<GraphVertex, String> names, Map<String, Integer> counters,
            List<GraphVertex> channels, StringBuilder str) {
        String sep = PrintTools.line_sep;
        for (GraphVertex v : g.getVertices()) {
            String name = "n" + names.size();
            names.put(v, name);
            str.append(indent).append(v.toDot(name)).append(";").append(sep);
            if (v.getType() == VertexType.CHANNEL) {
                channels.add(v);
            }
        }
        for (GraphVertex v : g.getVertices()) {
            for (GraphVertex succ : v.getSuccs()) {
                str.append(indent).append(names.get(v)).append(" -> ");
                str.append(names.get(succ)).append(";").append(sep);
            }
        }
        for (ScopeGraph child : g.getSubgraphs()) {
            String level = child.getLevelName();
            Integer n = counters.get(level);
            n = (n == null) ? 0 : n + 1;
            counters.put(level, n);
            str.append(indent).append("subgraph cluster_").append(level);
            str.append(n).append(" {").append(sep);
            str.append(indent).append("  label=\"").append(level).append(n);
            str.append("\";").append(sep);
            appendGraph(child, indent + "  ", names, counters, channels, str);
            str.append(indent).append("}").append(sep);
        }
        for (GraphVertex v : g.getVertices()) {
            if (v.getType() == VertexType.HIERARCHY
                    && v.getNextGraph() != null) {
                str.append(indent).append(names.get(v)).append(" -> ");
                str.append(names.get(v.getNextGraph().getStart()));
                str.append(";").append(sep);
            }
        }
    }

    private static boolean write(File file, String contents) {
        try {
            Writer w = new BufferedWriter(new FileWriter(file));
            try {
                w.write(contents);
            } finally {
                w.close();
            }
            PrintTools.printlnStatus(1, "wrote", file.getPath());
            return true;
        } catch (IOException e) {
            PrintTools.printlnWarning("failed to write " + file + ": " + e, 0);
            return false;
        }
    }

}
