package org.waabox.nexus.fetch;

/**
 * The outcome of fetching one page.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum PageStatus {

  /** The page was fetched and its items parsed. */
  OK,

  /** The source reported the page does not exist; pagination ends here. */
  NOT_FOUND,

  /** Every attempt failed; the page is dropped from the harvest. */
  UNAVAILABLE
}
