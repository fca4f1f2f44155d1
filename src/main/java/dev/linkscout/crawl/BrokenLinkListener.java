package dev.linkscout.crawl;

/** Receives each broken link the moment it is recorded, on the worker thread that found it. */
@FunctionalInterface
public interface BrokenLinkListener {

  BrokenLinkListener NONE = brokenLink -> {};

  void onBrokenLink(BrokenLink brokenLink);
}
