package com.py2smt;

import com.py2smt.smt.SmtTranslator;
import com.py2smt.smt.Sort;
import com.py2smt.source.CommentStripper;
import com.py2smt.source.PythonParser;
import com.py2smt.tree.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts Python subset source into SMT-LIB2 text: comments are stripped, the remainder
 * is parsed into a {@link SyntaxNode} tree, and the tree is translated with the configured
 * result sort.
 * <p>
 * Syntax errors surface as {@link com.py2smt.source.ParseException}; in strict mode
 * unsupported constructs surface as {@link com.py2smt.smt.UnsupportedConstructException}.
 */
public class PythonToSmtConverter {
    private static final Logger logger = LoggerFactory.getLogger(PythonToSmtConverter.class);

    private final Sort sort;
    private final CommentStripper commentStripper = new CommentStripper();
    private final SmtTranslator translator;

    public PythonToSmtConverter(Sort sort) {
        this(sort, false);
    }

    public PythonToSmtConverter(Sort sort, boolean strict) {
        this.sort = sort;
        this.translator = new SmtTranslator(strict);
    }

    public Sort getSort() {
        return sort;
    }

    public String convert(String pythonSource) {
        String clean = commentStripper.strip(pythonSource);
        logger.debug("Stripped comments: {} -> {} characters", pythonSource.length(), clean.length());

        SyntaxNode.Module tree = new PythonParser().parse(clean);
        logger.debug("Parsed {} top-level statements", tree.statements().size());

        return convert(tree);
    }

    public String convert(SyntaxNode tree) {
        return translator.translate(tree, sort);
    }
}
