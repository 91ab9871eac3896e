package fsmgen.util;

import java.math.BigInteger;
import java.util.Set;

/**
 * SystemVerilog text helpers shared by the RTL and testbench emitters.
 */
public class Verilog {
  public String tab = "    ";

  /** SystemVerilog (IEEE 1800-2017) reserved words, not usable as module, port or state names. */
  public static final Set<String> KEYWORDS = Set.of(
      "accept_on", "alias", "always", "always_comb", "always_ff", "always_latch", "and", "assert", "assign", "assume", "automatic",
      "before", "begin", "bind", "bins", "binsof", "bit", "break", "buf", "bufif0", "bufif1", "byte", "case", "casex", "casez",
      "cell", "chandle", "checker", "class", "clocking", "cmos", "config", "const", "constraint", "context", "continue", "cover",
      "covergroup", "coverpoint", "cross", "deassign", "default", "defparam", "design", "disable", "dist", "do", "edge", "else",
      "end", "endcase", "endchecker", "endclass", "endclocking", "endconfig", "endfunction", "endgenerate", "endgroup",
      "endinterface", "endmodule", "endpackage", "endprimitive", "endprogram", "endproperty", "endsequence", "endspecify", "endtable",
      "endtask", "enum", "event", "eventually", "expect", "export", "extends", "extern", "final", "first_match", "for", "force",
      "foreach", "forever", "fork", "forkjoin", "function", "generate", "genvar", "global", "highz0", "highz1", "if", "iff", "ifnone",
      "ignore_bins", "illegal_bins", "implements", "implies", "import", "incdir", "include", "initial", "inout", "input", "inside",
      "instance", "int", "integer", "interconnect", "interface", "intersect", "join", "join_any", "join_none", "large", "let",
      "liblist", "library", "local", "localparam", "logic", "longint", "macromodule", "matches", "medium", "modport", "module",
      "nand", "negedge", "nettype", "new", "nexttime", "nmos", "nor", "noshowcancelled", "not", "notif0", "notif1", "null", "or",
      "output", "package", "packed", "parameter", "pmos", "posedge", "primitive", "priority", "program", "property", "protected",
      "pull0", "pull1", "pulldown", "pullup", "pulsestyle_ondetect", "pulsestyle_onevent", "pure", "rand", "randc", "randcase",
      "randsequence", "rcmos", "real", "realtime", "ref", "reg", "reject_on", "release", "repeat", "restrict", "return", "rnmos",
      "rpmos", "rtran", "rtranif0", "rtranif1", "s_always", "s_eventually", "s_nexttime", "s_until", "s_until_with", "scalared",
      "sequence", "shortint", "shortreal", "showcancelled", "signed", "small", "soft", "solve", "specify", "specparam", "static",
      "string", "strong", "strong0", "strong1", "struct", "super", "supply0", "supply1", "sync_accept_on", "sync_reject_on", "table",
      "tagged", "task", "this", "throughout", "time", "timeprecision", "timeunit", "tran", "tranif0", "tranif1", "tri", "tri0",
      "tri1", "triand", "trior", "trireg", "type", "typedef", "union", "unique", "unique0", "unsigned", "until", "until_with",
      "untyped", "use", "uwire", "var", "vectored", "virtual", "void", "wait", "wait_order", "wand", "weak", "weak0", "weak1",
      "while", "wildcard", "wire", "with", "within", "wor", "xnor", "xor");

  public Verilog(String tab) { this.tab = tab; }

  /** Packed range for a signal of the given width, e.g. {@code [7:0] }; empty for single bit signals. */
  public static String CreateRange(int width) { return (width > 1) ? "[" + (width - 1) + ":0] " : ""; }

  /** Sized unsigned decimal literal, e.g. {@code 4'd8}. */
  public static String CreateLiteral(int width, BigInteger value) { return width + "'d" + value; }

  /** Generates text like : {@code logic [3:0] state, state_d;} */
  public String CreateDeclSig(int width, String... names) { return "logic " + CreateRange(width) + String.join(", ", names) + ";\n"; }

  /** Port declaration without the trailing comma, e.g. {@code input  logic [1:0] sel} */
  public String CreateTextInterface(boolean isInput, int width, String name) {
    return (isInput ? "input  " : "output ") + "logic " + CreateRange(width) + name;
  }

  /**
   * Wraps text in a sequential or combinational always block.
   * @param sensitivity sensitivity list of the always_ff block, or null for always_comb
   */
  public String CreateInAlways(String sensitivity, String text) {
    if (text.isEmpty())
      return "";
    String head = (sensitivity != null) ? "always_ff @(%s)".formatted(sensitivity) : "always_comb";
    return head + " begin\n" + AlignText(tab, text) + (text.endsWith("\n") ? "" : "\n") + "end\n";
  }

  /** Wraps text in {@code begin ... end} under the given statement head (if, else, case item...). */
  public String CreateBlock(String head, String text) {
    if (text.isEmpty())
      return head + " begin\nend\n";
    return head + " begin\n" + AlignText(tab, text) + (text.endsWith("\n") ? "" : "\n") + "end\n";
  }

  public String CreateBlocking(String assigSig, String toAssign) { return assigSig + " = " + toAssign + ";\n"; }

  public String CreateNonBlocking(String assigSig, String toAssign) { return assigSig + " <= " + toAssign + ";\n"; }

  /** Indents every non-empty line of text. */
  public static String AlignText(String alignment, String text) {
    if (text.isEmpty())
      return text;
    String first = text.startsWith("\n") ? "" : alignment;
    return first + text.replaceAll("(\\r\\n|\\n)(?![\\r\\n]|$)", "\n" + alignment);
  }
}
