package pretty;

import clojure.lang.*;

public interface Keywords {
  /** Configuration keys **/
  Keyword WIDTH = Keyword.intern("width");
  Keyword INDENT = Keyword.intern("indent");
}
