package tex2typst;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table from TeX command names (without backslash) to Typst symbol
 * spellings.
 *
 * Names that Typst spells the same way (Greek letters, {@code sum},
 * {@code sin}) are listed too, so the parser can tell a known symbol from an
 * unknown macro.
 */
public final class SymbolTable {
	private static final Map<String, String> SYMBOLS;

	static {
		final var m = new HashMap<String, String>();

		// Greek
		for (String same : new String[] { "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta",
				"iota", "kappa", "lambda", "mu", "nu", "xi", "omicron", "pi", "rho", "sigma", "tau", "upsilon", "chi",
				"psi", "omega", "Gamma", "Delta", "Theta", "Lambda", "Xi", "Pi", "Sigma", "Upsilon", "Phi", "Psi",
				"Omega" }) {
			m.put(same, same);
		}
		m.put("varepsilon", "epsilon.alt");
		m.put("vartheta", "theta.alt");
		m.put("varkappa", "kappa.alt");
		m.put("varpi", "pi.alt");
		m.put("varrho", "rho.alt");
		m.put("varsigma", "sigma.alt");
		m.put("phi", "phi.alt");
		m.put("varphi", "phi");

		// binary operators
		m.put("pm", "plus.minus");
		m.put("mp", "minus.plus");
		m.put("times", "times");
		m.put("div", "div");
		m.put("cdot", "dot.op");
		m.put("ast", "ast.op");
		m.put("star", "star.op");
		m.put("circ", "compose");
		m.put("bullet", "bullet");
		m.put("oplus", "plus.circle");
		m.put("ominus", "minus.circle");
		m.put("otimes", "times.circle");
		m.put("odot", "dot.circle");
		m.put("cap", "sect");
		m.put("cup", "union");
		m.put("sqcap", "sect.sq");
		m.put("sqcup", "union.sq");
		m.put("uplus", "union.plus");
		m.put("vee", "or");
		m.put("lor", "or");
		m.put("wedge", "and");
		m.put("land", "and");
		m.put("setminus", "without");
		m.put("wr", "wreath");
		m.put("amalg", "product.co");
		m.put("dagger", "dagger");
		m.put("ddagger", "dagger.double");

		// relations
		m.put("leq", "lt.eq");
		m.put("le", "lt.eq");
		m.put("geq", "gt.eq");
		m.put("ge", "gt.eq");
		m.put("leqslant", "lt.eq.slant");
		m.put("geqslant", "gt.eq.slant");
		m.put("neq", "eq.not");
		m.put("ne", "eq.not");
		m.put("equiv", "equiv");
		m.put("approx", "approx");
		m.put("sim", "tilde.op");
		m.put("simeq", "tilde.eq");
		m.put("cong", "tilde.equiv");
		m.put("lesssim", "lt.tilde");
		m.put("gtrsim", "gt.tilde");
		m.put("propto", "prop");
		m.put("ll", "lt.double");
		m.put("gg", "gt.double");
		m.put("prec", "prec");
		m.put("succ", "succ");
		m.put("preceq", "prec.eq");
		m.put("succeq", "succ.eq");
		m.put("subset", "subset");
		m.put("supset", "supset");
		m.put("subseteq", "subset.eq");
		m.put("supseteq", "supset.eq");
		m.put("subsetneq", "subset.neq");
		m.put("supsetneq", "supset.neq");
		m.put("nsubseteq", "subset.eq.not");
		m.put("sqsubset", "subset.sq");
		m.put("sqsupset", "supset.sq");
		m.put("sqsubseteq", "subset.eq.sq");
		m.put("sqsupseteq", "supset.eq.sq");
		m.put("in", "in");
		m.put("ni", "in.rev");
		m.put("notin", "in.not");
		m.put("mid", "divides");
		m.put("nmid", "divides.not");
		m.put("parallel", "parallel");
		m.put("perp", "perp");
		m.put("models", "models");
		m.put("vdash", "tack.r");
		m.put("dashv", "tack.l");
		m.put("asymp", "asymp");
		m.put("doteq", "eq.dot");

		// arrows
		m.put("to", "arrow.r");
		m.put("rightarrow", "arrow.r");
		m.put("leftarrow", "arrow.l");
		m.put("gets", "arrow.l");
		m.put("leftrightarrow", "arrow.l.r");
		m.put("Rightarrow", "arrow.r.double");
		m.put("Leftarrow", "arrow.l.double");
		m.put("Leftrightarrow", "arrow.l.r.double");
		m.put("longrightarrow", "arrow.r.long");
		m.put("longleftarrow", "arrow.l.long");
		m.put("longleftrightarrow", "arrow.l.r.long");
		m.put("Longrightarrow", "arrow.r.double.long");
		m.put("Longleftarrow", "arrow.l.double.long");
		m.put("Longleftrightarrow", "arrow.l.r.double.long");
		m.put("implies", "arrow.r.double.long");
		m.put("impliedby", "arrow.l.double.long");
		m.put("iff", "arrow.l.r.double.long");
		m.put("mapsto", "arrow.r.bar");
		m.put("longmapsto", "arrow.r.long.bar");
		m.put("hookrightarrow", "arrow.r.hook");
		m.put("hookleftarrow", "arrow.l.hook");
		m.put("uparrow", "arrow.t");
		m.put("downarrow", "arrow.b");
		m.put("updownarrow", "arrow.t.b");
		m.put("Uparrow", "arrow.t.double");
		m.put("Downarrow", "arrow.b.double");
		m.put("nearrow", "arrow.tr");
		m.put("searrow", "arrow.br");
		m.put("swarrow", "arrow.bl");
		m.put("nwarrow", "arrow.tl");
		m.put("rightharpoonup", "harpoon.rt");
		m.put("leftharpoonup", "harpoon.lt");
		m.put("rightleftharpoons", "harpoons.rtlb");

		// large operators
		m.put("sum", "sum");
		m.put("prod", "product");
		m.put("coprod", "product.co");
		m.put("int", "integral");
		m.put("iint", "integral.double");
		m.put("iiint", "integral.triple");
		m.put("oint", "integral.cont");
		m.put("bigcup", "union.big");
		m.put("bigcap", "sect.big");
		m.put("bigsqcup", "union.sq.big");
		m.put("bigvee", "or.big");
		m.put("bigwedge", "and.big");
		m.put("bigoplus", "plus.circle.big");
		m.put("bigotimes", "times.circle.big");
		m.put("bigodot", "dot.circle.big");

		// operator names Typst knows by the same name
		for (String same : new String[] { "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
				"sinh", "cosh", "tanh", "coth", "exp", "log", "ln", "lg", "lim", "limsup", "liminf", "max", "min",
				"sup", "inf", "det", "dim", "ker", "deg", "arg", "gcd", "lcm", "hom", "Pr", "mod" }) {
			m.put(same, same);
		}

		// one-argument styles and accents, used as call names
		m.put("mathbb", "bb");
		m.put("mathcal", "cal");
		m.put("mathfrak", "frak");
		m.put("mathscr", "scr");
		m.put("mathit", "italic");
		m.put("mathrm", "upright");
		m.put("rm", "upright");
		m.put("mathsf", "sans");
		m.put("mathtt", "mono");
		m.put("boldsymbol", "bold");
		m.put("pmb", "bold");
		m.put("bar", "macron");
		m.put("ddot", "dot.double");
		m.put("vec", "arrow");
		m.put("overrightarrow", "arrow");
		m.put("widehat", "hat");
		m.put("widetilde", "tilde");
		m.put("dbinom", "binom");
		m.put("tbinom", "binom");

		// delimiters
		m.put("{", "{");
		m.put("}", "}");
		m.put("lbrace", "brace.l");
		m.put("rbrace", "brace.r");
		m.put("lbrack", "bracket.l");
		m.put("rbrack", "bracket.r");
		m.put("lfloor", "floor.l");
		m.put("rfloor", "floor.r");
		m.put("lceil", "ceil.l");
		m.put("rceil", "ceil.r");
		m.put("langle", "angle.l");
		m.put("rangle", "angle.r");
		m.put("vert", "bar.v");
		m.put("lvert", "bar.v");
		m.put("rvert", "bar.v");
		m.put("Vert", "bar.v.double");
		m.put("lVert", "bar.v.double");
		m.put("rVert", "bar.v.double");
		m.put("backslash", "backslash");

		// spacing
		m.put("quad", "quad");
		m.put("qquad", "wide");
		m.put(";", "thick");
		m.put(":", "med");
		m.put(">", "med");
		m.put(" ", "space");
		m.put("!", "#h(-0.17em)");

		// miscellaneous
		m.put("infty", "infinity");
		m.put("partial", "diff");
		m.put("nabla", "nabla");
		m.put("forall", "forall");
		m.put("exists", "exists");
		m.put("nexists", "exists.not");
		m.put("emptyset", "emptyset");
		m.put("varnothing", "nothing");
		m.put("neg", "not");
		m.put("lnot", "not");
		m.put("top", "top");
		m.put("bot", "bot");
		m.put("angle", "angle");
		m.put("triangle", "triangle.stroke.t");
		m.put("square", "square");
		m.put("Box", "square.stroke");
		m.put("ell", "ell");
		m.put("hbar", "planck.reduce");
		m.put("hslash", "planck.reduce");
		m.put("Re", "Re");
		m.put("Im", "Im");
		m.put("aleph", "aleph");
		m.put("beth", "beth");
		m.put("imath", "dotless.i");
		m.put("jmath", "dotless.j");
		m.put("complement", "complement");
		m.put("prime", "prime");
		m.put("degree", "degree");
		m.put("dots", "dots.h");
		m.put("ldots", "dots.h");
		m.put("cdots", "dots.h.c");
		m.put("vdots", "dots.v");
		m.put("ddots", "dots.down");
		m.put("therefore", "therefore");
		m.put("because", "because");
		m.put("checkmark", "checkmark");
		m.put("clubsuit", "suit.club");
		m.put("diamondsuit", "suit.diamond");
		m.put("heartsuit", "suit.heart");
		m.put("spadesuit", "suit.spade");
		m.put("flat", "flat");
		m.put("sharp", "sharp");
		m.put("natural", "natural");
		m.put("S", "section");
		m.put("P", "pilcrow");
		m.put("colon", "colon");

		SYMBOLS = Map.copyOf(m);
	}

	private SymbolTable() {
		// utility class
	}

	public static boolean contains(String name) {
		return SYMBOLS.containsKey(name);
	}

	public static Optional<String> lookup(String name) {
		return Optional.ofNullable(SYMBOLS.get(name));
	}
}
