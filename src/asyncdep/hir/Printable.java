package asyncdep.hir;

import java.io.PrintWriter;

/**
* Any class implementing this interface can print itself in the textual
* form used for dumps and debugging messages.
*/
public interface Printable {

    /**
    * Prints the object on the specified writer.
    *
    * @param o The writer on which to print the data.
    */
    void print(PrintWriter o);

}
