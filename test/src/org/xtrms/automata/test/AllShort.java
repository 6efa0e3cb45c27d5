/* @LICENSE@  
 */


package org.xtrms.automata.test;

import org.xtrms.automata.DFATestCase;
import org.xtrms.automata.DescriptionParserTestCase;
import org.xtrms.automata.LexerTestCase;
import org.xtrms.automata.NFATestCase;
import org.xtrms.automata.PDATestCase;
import org.xtrms.automata.TMTestCase;
import org.xtrms.automata.TapeTestCase;

import junit.framework.Test;
import junit.framework.TestSuite;

public class AllShort {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AllShort.suite());
    }

    public static Test suite() {
        TestSuite suite = new TestSuite("Short test suite.");
        //$JUnit-BEGIN$
        suite.addTestSuite(LexerTestCase.class);
        suite.addTestSuite(DescriptionParserTestCase.class);
        suite.addTestSuite(DFATestCase.class);
        suite.addTestSuite(NFATestCase.class);
        suite.addTestSuite(PDATestCase.class);
        suite.addTestSuite(TapeTestCase.class);
        suite.addTestSuite(TMTestCase.class);
        suite.addTestSuite(ScenarioTestCase.class);
        //$JUnit-END$
        return suite;
    }

}
